package io.kairos.cli;

@FunctionalInterface
public interface ServeRunner {
    int run(Integer portOverride, boolean follow) throws Exception;
}
