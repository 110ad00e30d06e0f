package ai.pipestream.frames.fetch;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves a hostname to every address it maps to.
 */
@FunctionalInterface
public interface HostResolver {

    HostResolver SYSTEM = InetAddress::getAllByName;

    InetAddress[] resolve(String host) throws UnknownHostException;
}
