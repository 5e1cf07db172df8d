package net.jodah.redial.config;

import java.util.Map;

import javax.net.ssl.SSLContext;

import net.jodah.redial.internal.util.Assert;
import net.jodah.redial.util.Duration;

import com.rabbitmq.client.ConnectionFactory;

/**
 * Connection settings that are applied on top of a dial uri. Unset settings keep the values parsed
 * from the uri, or the ConnectionFactory defaults.
 *
 * @author Jonathan Halterman
 */
public class DialConfig {
  private ConnectionFactory factory;
  private String name;
  private String virtualHost;
  private String username;
  private String password;
  private Duration requestedHeartbeat;
  private Duration connectionTimeout;
  private Integer requestedChannelMax;
  private Integer requestedFrameMax;
  private Map<String, Object> clientProperties;
  private SSLContext sslContext;

  public DialConfig() {
  }

  private DialConfig(DialConfig config) {
    factory = config.factory;
    name = config.name;
    virtualHost = config.virtualHost;
    username = config.username;
    password = config.password;
    requestedHeartbeat = config.requestedHeartbeat;
    connectionTimeout = config.connectionTimeout;
    requestedChannelMax = config.requestedChannelMax;
    requestedFrameMax = config.requestedFrameMax;
    clientProperties = config.clientProperties;
    sslContext = config.sslContext;
  }

  /**
   * Returns a new copy of the config.
   */
  public DialConfig copy() {
    return new DialConfig(this);
  }

  /**
   * Applies the configured settings to the {@code factory}.
   */
  public void applyTo(ConnectionFactory factory) {
    if (virtualHost != null)
      factory.setVirtualHost(virtualHost);
    if (username != null)
      factory.setUsername(username);
    if (password != null)
      factory.setPassword(password);
    if (requestedHeartbeat != null)
      factory.setRequestedHeartbeat((int) requestedHeartbeat.toSeconds());
    if (connectionTimeout != null)
      factory.setConnectionTimeout((int) connectionTimeout.toMillis());
    if (requestedChannelMax != null)
      factory.setRequestedChannelMax(requestedChannelMax);
    if (requestedFrameMax != null)
      factory.setRequestedFrameMax(requestedFrameMax);
    if (clientProperties != null)
      factory.setClientProperties(clientProperties);
    if (sslContext != null)
      factory.useSslProtocol(sslContext);
  }

  /**
   * Returns the ConnectionFactory to dial with, else null if a new factory should be created.
   */
  public ConnectionFactory getConnectionFactory() {
    return factory;
  }

  /**
   * Returns the connection name. Used for logging and as the client-provided connection name.
   */
  public String getName() {
    return name;
  }

  public SSLContext getSslContext() {
    return sslContext;
  }

  public String getVirtualHost() {
    return virtualHost;
  }

  /**
   * Sets the client properties.
   *
   * @throws NullPointerException if {@code clientProperties} is null
   */
  public DialConfig withClientProperties(Map<String, Object> clientProperties) {
    this.clientProperties = Assert.notNull(clientProperties, "clientProperties");
    return this;
  }

  /**
   * Sets the {@code connectionFactory} to dial with. Its settings are overridden by the uri and by
   * this config.
   *
   * @throws NullPointerException if {@code connectionFactory} is null
   */
  public DialConfig withConnectionFactory(ConnectionFactory connectionFactory) {
    this.factory = Assert.notNull(connectionFactory, "connectionFactory");
    return this;
  }

  /**
   * Sets the connection timeout, zero for infinite, for an individual dial attempt.
   *
   * @throws NullPointerException if {@code connectionTimeout} is null
   */
  public DialConfig withConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = Assert.notNull(connectionTimeout, "connectionTimeout");
    return this;
  }

  /**
   * Sets the connection name.
   *
   * @throws NullPointerException if {@code name} is null
   */
  public DialConfig withName(String name) {
    this.name = Assert.notNull(name, "name");
    return this;
  }

  public DialConfig withPassword(String password) {
    this.password = password;
    return this;
  }

  /**
   * Sets the maximum channel number to negotiate, zero for unlimited.
   */
  public DialConfig withRequestedChannelMax(int requestedChannelMax) {
    this.requestedChannelMax = requestedChannelMax;
    return this;
  }

  /**
   * Sets the maximum frame size to negotiate, zero for unlimited.
   */
  public DialConfig withRequestedFrameMax(int requestedFrameMax) {
    this.requestedFrameMax = requestedFrameMax;
    return this;
  }

  /**
   * Sets the requested heartbeat, zero for none.
   *
   * @throws NullPointerException if {@code requestedHeartbeat} is null
   */
  public DialConfig withRequestedHeartbeat(Duration requestedHeartbeat) {
    this.requestedHeartbeat = Assert.notNull(requestedHeartbeat, "requestedHeartbeat");
    return this;
  }

  /**
   * Sets the initialized {@code sslContext} to use.
   *
   * @throws NullPointerException if {@code sslContext} is null
   */
  public DialConfig withSslContext(SSLContext sslContext) {
    this.sslContext = Assert.notNull(sslContext, "sslContext");
    return this;
  }

  /**
   * Sets the username.
   *
   * @throws NullPointerException if {@code username} is null
   */
  public DialConfig withUsername(String username) {
    this.username = Assert.notNull(username, "username");
    return this;
  }

  /**
   * Sets the virtual host.
   *
   * @throws NullPointerException if {@code virtualHost} is null
   */
  public DialConfig withVirtualHost(String virtualHost) {
    this.virtualHost = Assert.notNull(virtualHost, "virtualHost");
    return this;
  }
}
