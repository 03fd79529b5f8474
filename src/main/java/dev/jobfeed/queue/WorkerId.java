package dev.jobfeed.queue;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identity of this process in execution records, {@code host-uuid}.
 */
public final class WorkerId {

    private static final String PROCESS_ID = create();

    private WorkerId() {
    }

    public static String current() {
        return PROCESS_ID;
    }

    private static String create() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + UUID.randomUUID();
        } catch (UnknownHostException e) {
            return "worker-" + UUID.randomUUID();
        }
    }
}
