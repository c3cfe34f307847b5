package com.questrail.flicker.api;

/**
 * DeviceHandle
 * -----------------------------------------------------------------------------
 * Opaque capability used by phase commands to interact with the device under
 * test (sending input, launching apps, querying UI state).
 *
 * <p>The harness never inspects a {@code DeviceHandle}. It is carried by the
 * {@link com.questrail.flicker.Flicker} instance and handed back to every
 * {@link TransitionCommand} through {@code flicker.device()}. Implementations
 * are expected to expose their own driver API and are narrowed by the command
 * code that knows which driver it runs against.</p>
 */
public interface DeviceHandle
{
}
