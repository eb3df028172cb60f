package io.kairos.cli;

/**
 * Opens the job registry a command works against: the gateway at {@code gatewayUrl} when one is
 * given, otherwise the local store.
 */
@FunctionalInterface
public interface RegistryProvider {
    OpenRegistry open(String gatewayUrl) throws Exception;
}
