package com.allowance.domain.port;

import java.util.Map;
import java.util.UUID;

/**
 * Fire-and-forget notification delivery. Implementations must not throw.
 */
public interface Notifier {

    void notifyFamily(UUID familyId, String message, Map<String, Object> payload);

    void notifyChild(UUID childId, String message, Map<String, Object> payload);
}
