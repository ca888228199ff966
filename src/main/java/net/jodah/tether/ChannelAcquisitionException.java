package net.jodah.tether;

import java.io.IOException;

/**
 * Thrown when a channel cannot be obtained from a {@link ConnectionPool}.
 * 
 * @author Jonathan Halterman
 */
public class ChannelAcquisitionException extends IOException {
  private static final long serialVersionUID = 6132281736044412153L;

  public ChannelAcquisitionException(String message) {
    super(message);
  }

  public ChannelAcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
