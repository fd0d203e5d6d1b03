package com.shellysvn.core.model;

import java.io.Serializable;

/**
 * Lock held on a working-copy path.
 *
 * @param owner   user holding the lock
 * @param comment lock comment, empty when none was given
 * @param date    creation timestamp as reported
 */
public record LockInfo(
    String owner,
    String comment,
    String date
) implements Serializable {}
