package net.jodah.redial.internal;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;

import javax.net.ssl.SSLContext;

import net.jodah.redial.config.DialConfig;
import net.jodah.redial.internal.util.Assert;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

/**
 * What a connection dials, and redials, to: a uri alone, a uri with an SSLContext, or a uri with a
 * {@link DialConfig}.
 *
 * @author Jonathan Halterman
 */
public final class DialTarget {
  public enum Kind {
    URI, TLS, CONFIG
  }

  private final Kind kind;
  private final String uri;
  private final SSLContext sslContext;
  private final DialConfig config;
  private final ConnectionFactory factory;

  private DialTarget(Kind kind, String uri, SSLContext sslContext, DialConfig config,
      ConnectionFactory factory) {
    this.kind = kind;
    this.uri = Assert.notNull(uri, "uri");
    this.sslContext = sslContext;
    this.config = config;
    this.factory = Assert.notNull(factory, "factory");
  }

  public static DialTarget uri(String uri, ConnectionFactory factory) {
    return new DialTarget(Kind.URI, uri, null, null, factory);
  }

  public static DialTarget tls(String uri, SSLContext sslContext, ConnectionFactory factory) {
    return new DialTarget(Kind.TLS, uri, Assert.notNull(sslContext, "sslContext"), null, factory);
  }

  public static DialTarget config(String uri, DialConfig config) {
    Assert.notNull(config, "config");
    ConnectionFactory factory = config.getConnectionFactory() == null ? new ConnectionFactory()
        : config.getConnectionFactory();
    return new DialTarget(Kind.CONFIG, uri, null, config.copy(), factory);
  }

  /**
   * Opens a new connection.
   *
   * @throws IllegalArgumentException if the uri is invalid
   * @throws IOException if the connection could not be opened
   * @throws TimeoutException if the connection attempt timed out
   */
  public Connection dial() throws IOException, TimeoutException {
    synchronized (factory) {
      try {
        factory.setUri(uri);
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("Invalid uri: " + redactedUri(), e);
      } catch (GeneralSecurityException e) {
        throw new IllegalArgumentException("Cannot configure TLS for " + redactedUri(), e);
      }

      switch (kind) {
        case TLS:
          factory.useSslProtocol(sslContext);
          break;
        case CONFIG:
          config.applyTo(factory);
          break;
        default:
          break;
      }

      String name = config == null ? null : config.getName();
      return name == null ? factory.newConnection() : factory.newConnection(name);
    }
  }

  public Kind getKind() {
    return kind;
  }

  public String getUri() {
    return uri;
  }

  public SSLContext getSslContext() {
    return sslContext;
  }

  public DialConfig getConfig() {
    return config;
  }

  ConnectionFactory getFactory() {
    return factory;
  }

  /**
   * Returns the uri without credentials.
   */
  String redactedUri() {
    int schemeEnd = uri.indexOf("://");
    int at = uri.indexOf('@');
    if (schemeEnd == -1 || at == -1 || at < schemeEnd)
      return uri;
    return uri.substring(0, schemeEnd + 3) + uri.substring(at + 1);
  }

  @Override
  public String toString() {
    return String.format("%s %s", kind, redactedUri());
  }
}
