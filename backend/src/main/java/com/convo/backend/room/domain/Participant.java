package com.convo.backend.room.domain;

import java.util.Objects;

/**
 * A connected member of a room. The connection id is assigned by the transport, the display
 * name comes from the client and is not required to be unique.
 */
public record Participant(String connectionId, String displayName) {

  public Participant {
    Objects.requireNonNull(connectionId, "connectionId must not be null");
    Objects.requireNonNull(displayName, "displayName must not be null");
  }
}
