package io.meshpager;

import io.meshpager.cli.MeshPagerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MeshPagerCommand()).execute(args);
        System.exit(code);
    }
}
