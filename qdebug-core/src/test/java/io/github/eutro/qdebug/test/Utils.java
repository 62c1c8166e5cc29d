package io.github.eutro.qdebug.test;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

public class Utils {
    public static final List<String> PROGRAMS = Arrays.asList(
            "bell.qasm",
            "teleport.qasm",
            "nested.qasm",
            "comments.qasm"
    );

    @NotNull
    public static String getProgram(String name) throws IOException {
        try (InputStream stream = Utils.class.getResourceAsStream("/programs/" + name)) {
            if (stream == null) throw new IOException("no such program: " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
