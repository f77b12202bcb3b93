package com.gateway.generator;

import com.gateway.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the gRPC gateway generator.
 * Reads a protobuf descriptor set and writes a .pb.gw.go reverse-proxy file
 * for every proto file that binds RPC methods to HTTP routes.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
