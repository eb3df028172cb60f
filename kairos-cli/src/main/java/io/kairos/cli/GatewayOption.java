package io.kairos.cli;

import picocli.CommandLine.Option;

public final class GatewayOption {

    @Option(names = "--url", description = "Gateway of a running daemon, e.g. http://127.0.0.1:8790")
    String url;
}
