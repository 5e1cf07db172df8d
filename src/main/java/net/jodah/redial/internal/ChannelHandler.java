package net.jodah.redial.internal;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import net.jodah.redial.AmqpChannel;
import net.jodah.redial.Delivery;
import net.jodah.redial.internal.util.Assert;
import net.jodah.redial.util.Pipe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Delegates channel operations to an amqp-client channel.
 *
 * @author Jonathan Halterman
 */
public class ChannelHandler implements AmqpChannel {
  private static final Logger LOG = LoggerFactory.getLogger(ChannelHandler.class);

  final Channel delegate;
  private final ConnectionHandler connectionHandler;

  ChannelHandler(ConnectionHandler connectionHandler, Channel delegate) {
    this.connectionHandler = connectionHandler;
    this.delegate = delegate;
  }

  /**
   * Hands deliveries off to a pipe, closing the pipe once the consumer stops.
   */
  private class PipeConsumer extends DefaultConsumer {
    private final Pipe<Delivery> deliveries;

    PipeConsumer(Pipe<Delivery> deliveries) {
      super(delegate);
      this.deliveries = deliveries;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope,
        AMQP.BasicProperties properties, byte[] body) {
      Delivery.Builder builder = Delivery.builder(ChannelHandler.this, envelope.getDeliveryTag())
          .body(body)
          .consumerTag(consumerTag)
          .exchange(envelope.getExchange())
          .routingKey(envelope.getRoutingKey())
          .redelivered(envelope.isRedeliver());
      if (properties != null)
        builder.headers(properties.getHeaders())
            .messageId(properties.getMessageId())
            .contentType(properties.getContentType())
            .timestamp(properties.getTimestamp());
      Delivery delivery = builder.build();

      try {
        deliveries.send(delivery);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.warn("Interrupted while handing off {} on {}", delivery, ChannelHandler.this);
      } catch (IllegalStateException e) {
        LOG.warn("Discarded {} on {} since its pipe is closed", delivery, ChannelHandler.this);
      }
    }

    @Override
    public void handleCancel(String consumerTag) {
      deliveries.close();
    }

    @Override
    public void handleCancelOk(String consumerTag) {
      deliveries.close();
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sse) {
      deliveries.close();
    }
  }

  @Override
  public void ack(long deliveryTag, boolean multiple) throws IOException {
    delegate.basicAck(deliveryTag, multiple);
  }

  @Override
  public void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
    delegate.basicNack(deliveryTag, multiple, requeue);
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) throws IOException {
    delegate.basicReject(deliveryTag, requeue);
  }

  @Override
  public void publish(String exchange, String routingKey, byte[] body,
      AMQP.BasicProperties properties) throws IOException {
    delegate.basicPublish(exchange, routingKey, properties, body);
  }

  @Override
  public void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete,
      Map<String, Object> arguments) throws IOException {
    delegate.exchangeDeclare(exchange, type, durable, autoDelete, arguments);
  }

  @Override
  public String queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete,
      Map<String, Object> arguments) throws IOException {
    return delegate.queueDeclare(queue, durable, exclusive, autoDelete, arguments).getQueue();
  }

  @Override
  public void queueBind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments) throws IOException {
    delegate.queueBind(queue, exchange, routingKey, arguments);
  }

  @Override
  public void queueUnbind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments) throws IOException {
    delegate.queueUnbind(queue, exchange, routingKey, arguments);
  }

  @Override
  public void qos(int prefetchCount, int prefetchSize, boolean global) throws IOException {
    delegate.basicQos(prefetchSize, prefetchCount, global);
  }

  @Override
  public String consume(String queue, String consumerTag, boolean autoAck,
      Pipe<Delivery> deliveries) throws IOException {
    Assert.notNull(deliveries, "deliveries");
    String tag = delegate.basicConsume(queue, autoAck, consumerTag == null ? "" : consumerTag,
        new PipeConsumer(deliveries));
    LOG.debug("Started consumer {} of {} on {}", tag, queue, this);
    return tag;
  }

  @Override
  public void cancel(String consumerTag) throws IOException {
    delegate.basicCancel(consumerTag);
  }

  @Override
  public int getChannelNumber() {
    return delegate.getChannelNumber();
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public void close() throws IOException, TimeoutException {
    delegate.close();
  }

  @Override
  public String toString() {
    return String.format("channel-%s on %s", delegate.getChannelNumber(), connectionHandler);
  }
}
