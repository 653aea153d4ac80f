package io.codesync.admission;

import java.net.InetAddress;

/**
 * Gate consulted once per connection attempt, before any document state is touched.
 */
public interface AdmissionControl {

    /**
     * @param address client address; may be {@code null} when the transport cannot tell
     * @return {@code true} to admit the connection
     */
    boolean tryAdmit(InetAddress address);

    /**
     * Admits everything. For tests and trusted deployments.
     */
    AdmissionControl ALLOW_ALL = address -> true;
}
