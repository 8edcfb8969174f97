package com.router.dto.event;

/**
 * One line of the deep-execution event stream. The {@code type} discriminator is always the
 * first property of the serialized object.
 */
public interface StreamEvent {

    String type();
}
