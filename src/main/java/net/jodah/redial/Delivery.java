package net.jodah.redial;

import java.io.IOException;
import java.util.Collections;
import java.util.Date;
import java.util.Map;

/**
 * A message delivered to a consumer. Acknowledgements are routed to the channel the message was
 * delivered on.
 * 
 * @author Jonathan Halterman
 */
public final class Delivery {
  private final AmqpChannel channel;
  private final byte[] body;
  private final Map<String, Object> headers;
  private final long deliveryTag;
  private final String consumerTag;
  private final String messageId;
  private final String contentType;
  private final Date timestamp;
  private final String exchange;
  private final String routingKey;
  private final boolean redelivered;

  private Delivery(Builder builder) {
    this.channel = builder.channel;
    this.body = builder.body;
    this.headers = builder.headers == null ? Collections.<String, Object>emptyMap()
        : Collections.unmodifiableMap(builder.headers);
    this.deliveryTag = builder.deliveryTag;
    this.consumerTag = builder.consumerTag;
    this.messageId = builder.messageId;
    this.contentType = builder.contentType;
    this.timestamp = builder.timestamp;
    this.exchange = builder.exchange;
    this.routingKey = builder.routingKey;
    this.redelivered = builder.redelivered;
  }

  public static Builder builder(AmqpChannel channel, long deliveryTag) {
    return new Builder(channel, deliveryTag);
  }

  public void ack(boolean multiple) throws IOException {
    channel.ack(deliveryTag, multiple);
  }

  public void nack(boolean multiple, boolean requeue) throws IOException {
    channel.nack(deliveryTag, multiple, requeue);
  }

  public void reject(boolean requeue) throws IOException {
    channel.nack(deliveryTag, false, requeue);
  }

  public byte[] getBody() {
    return body;
  }

  public Map<String, Object> getHeaders() {
    return headers;
  }

  public long getDeliveryTag() {
    return deliveryTag;
  }

  public String getConsumerTag() {
    return consumerTag;
  }

  public String getMessageId() {
    return messageId;
  }

  public String getContentType() {
    return contentType;
  }

  /**
   * Returns the timestamp set by the publisher, else null.
   */
  public Date getTimestamp() {
    return timestamp == null ? null : new Date(timestamp.getTime());
  }

  public String getExchange() {
    return exchange;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  public boolean isRedelivered() {
    return redelivered;
  }

  @Override
  public String toString() {
    return String.format("Delivery[tag=%s, consumerTag=%s, messageId=%s]", deliveryTag,
        consumerTag, messageId);
  }

  public static final class Builder {
    private final AmqpChannel channel;
    private final long deliveryTag;
    private byte[] body = new byte[0];
    private Map<String, Object> headers;
    private String consumerTag;
    private String messageId;
    private String contentType;
    private Date timestamp;
    private String exchange;
    private String routingKey;
    private boolean redelivered;

    private Builder(AmqpChannel channel, long deliveryTag) {
      this.channel = channel;
      this.deliveryTag = deliveryTag;
    }

    public Builder body(byte[] body) {
      this.body = body == null ? new byte[0] : body;
      return this;
    }

    public Builder headers(Map<String, Object> headers) {
      this.headers = headers;
      return this;
    }

    public Builder consumerTag(String consumerTag) {
      this.consumerTag = consumerTag;
      return this;
    }

    public Builder messageId(String messageId) {
      this.messageId = messageId;
      return this;
    }

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder timestamp(Date timestamp) {
      this.timestamp = timestamp == null ? null : new Date(timestamp.getTime());
      return this;
    }

    public Builder exchange(String exchange) {
      this.exchange = exchange;
      return this;
    }

    public Builder routingKey(String routingKey) {
      this.routingKey = routingKey;
      return this;
    }

    public Builder redelivered(boolean redelivered) {
      this.redelivered = redelivered;
      return this;
    }

    public Delivery build() {
      return new Delivery(this);
    }
  }
}
