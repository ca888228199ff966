package net.jodah.tether.messaging;

/**
 * The outcome of handling a delivery.
 * 
 * @author Jonathan Halterman
 */
public enum Action {
  /** Acknowledge the delivery. */
  ACK,
  /** Reject the delivery without requeueing it. */
  NACK_DISCARD,
  /** Reject the delivery and requeue it for redelivery. */
  NACK_REQUEUE
}
