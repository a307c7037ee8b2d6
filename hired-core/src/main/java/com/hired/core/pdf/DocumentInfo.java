package com.hired.core.pdf;

import java.time.ZonedDateTime;

/**
 * Document information dictionary entries.
 *
 * <p>{@code creationDate} is the only non-deterministic value in the serialized
 * document; it is null when timestamps are disabled.
 *
 * @param title document title, may be null
 * @param producer producing application
 * @param creationDate creation timestamp, may be null
 */
public record DocumentInfo(
    String title,
    String producer,
    ZonedDateTime creationDate
) {
}
