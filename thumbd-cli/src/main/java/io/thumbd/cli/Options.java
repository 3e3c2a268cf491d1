package io.thumbd.cli;

import java.io.IOException;
import java.nio.file.Path;

final class Options {

    private Options() {}

    static String requireValue(String[] args, int index, String optionName) {
        if (index >= args.length) {
            throw new IllegalArgumentException(optionName + " requires a value");
        }
        return args[index];
    }

    static int requireIntValue(String[] args, int index, String optionName) {
        String value = requireValue(args, index, optionName);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(optionName + " must be a valid integer, got: " + value);
        }
    }

    static ThumbdConfig loadConfig(Path configFile, Path root) throws IOException {
        return configFile == null ? ThumbdConfig.defaults(root) : ThumbdConfig.load(configFile, root);
    }
}
