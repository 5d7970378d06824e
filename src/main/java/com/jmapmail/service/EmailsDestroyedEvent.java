package com.jmapmail.service;

import lombok.Value;

import java.util.List;

/**
 * Published when account messages are soft-deleted; carries their canonical message ids
 */
@Value
public class EmailsDestroyedEvent {

    List<String> canonicalMessageIds;
}
