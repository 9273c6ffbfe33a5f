package cryptorandom.server.util;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Configuration parameters, merged from {@code -key value} arguments, an optional
 * {@code key = value} config file and the environment.
 */
public class Args {
    public static final String CONFIG_FILE = "config-file";

    private final Map<String, String> params;//insertion order

    public Args(Map<String, String> params) {
        this.params = params;
    }

    public static Args empty() {
        return new Args(paramMap());
    }

    public String getArg(String param, String def) {
        if (!params.containsKey(param))
            return def;
        return params.get(param);
    }

    public String getArg(String param) {
        if (!params.containsKey(param))
            throw new IllegalStateException("No parameter: " + param);
        return params.get(param);
    }

    public Optional<String> getOptionalArg(String param) {
        return Optional.ofNullable(params.get(param));
    }

    public boolean hasArg(String arg) {
        return params.containsKey(arg);
    }

    public boolean getBoolean(String param, boolean def) {
        if (!params.containsKey(param))
            return def;
        return "true".equals(params.get(param));
    }

    public int getInt(String param, int def) {
        if (!params.containsKey(param))
            return def;
        try {
            return Integer.parseInt(params.get(param));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + param + ": " + params.get(param), e);
        }
    }

    public Args with(String key, String value) {
        Map<String, String> map = paramMap();
        map.putAll(params);
        map.put(key, value);
        return new Args(map);
    }

    private static Map<String, String> parseEnv() {
        Map<String, String> map = paramMap();
        map.putAll(System.getenv());
        return map;
    }

    private static Map<String, String> parseFile(Path path) {
        if (! Files.exists(path))
            return Collections.emptyMap();
        try {
            Map<String, String> map = paramMap();
            Files.readAllLines(path).stream()
                    .filter(line -> !line.isBlank())
                    .map(Args::parseLine)
                    .flatMap(Optional::stream)
                    .forEach(e -> map.put(e.getKey(), e.getValue()));
            return map;
        } catch (IOException ioe) {
            throw new IllegalStateException(ioe.getMessage(), ioe);
        }
    }

    private static Map<String, String> parseParams(String[] args) {
        Map<String, String> map = paramMap();
        for (int i = 0; i < args.length; i++) {
            String argName = args[i];
            if (argName.startsWith("-"))
                argName = argName.substring(1);

            if ((i == args.length - 1) || args[i + 1].startsWith("-"))
                map.put(argName, "true");
            else
                map.put(argName, args[++i]);
        }
        return map;
    }

    /**
     * params overrides configFile overrides env
     */
    public static Args parse(String[] params, Optional<Path> configFile, boolean includeEnv) {
        Map<String, String> fromEnv = includeEnv ? parseEnv() : Collections.emptyMap();
        Map<String, String> fromParams = parseParams(params);
        Optional<Path> file = configFile.or(() -> Optional.ofNullable(fromParams.get(CONFIG_FILE)).map(Paths::get));
        Map<String, String> fromFile = file.map(Args::parseFile).orElse(Collections.emptyMap());

        Map<String, String> combined = paramMap();
        Stream.of(
                fromParams.entrySet(),
                fromFile.entrySet(),
                fromEnv.entrySet()
        )
                .flatMap(e -> e.stream())
                .forEach(e -> combined.putIfAbsent(e.getKey(), e.getValue()));

        return new Args(combined);
    }

    public static Args parse(String[] args) {
        return parse(args, Optional.empty(), true);
    }

    /**
     * Parses a line of the form "key = value", with an optional trailing " # comment".
     * Lines starting with # are ignored.
     */
    private static Optional<Map.Entry<String, String>> parseLine(String originalLine) {
        String line = originalLine.trim();

        int commentPos = line.indexOf("#");
        if (commentPos == 0)
            return Optional.empty();

        // Enforce a space before # for a comment not at start of line
        if (commentPos != -1 && line.charAt(commentPos - 1) == ' ')
            line = line.substring(0, commentPos).trim();

        String[] split = line.split("=");
        if (split.length != 2)
            throw new IllegalStateException("Illegal line '" + line + "'");

        return Optional.of(Map.entry(split[0].trim(), split[1].trim()));
    }

    private static <K, V> Map<K, V> paramMap() {
        return new LinkedHashMap<>(16, 0.75f, false);
    }
}
