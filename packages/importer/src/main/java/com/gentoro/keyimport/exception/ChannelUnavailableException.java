package com.gentoro.keyimport.exception;

/** A handshake response could not be sent: the response slot is occupied or nobody waits. */
public class ChannelUnavailableException extends KeyImportException {
  public ChannelUnavailableException(String message) {
    super(KeyImportErrorCode.CHANNEL_UNAVAILABLE, message);
  }
}
