package com.acme.cievidence.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

public final class FsUtil {
    private FsUtil() {}

    public static Map<String, Object> fileStat(Path p) {
        Map<String, Object> o = new LinkedHashMap<>();
        o.put("path", p == null ? null : p.toString());
        if (p == null) {
            o.put("exists", false);
            o.put("reason", "not provided");
            return o;
        }
        o.put("exists", Files.exists(p));
        o.put("is_dir", Files.isDirectory(p));
        o.put("is_file", Files.isRegularFile(p));
        return o;
    }

    /** Whole file as UTF-8. Never truncates: a file over {@code maxBytes} is an {@link IOException}. */
    public static String readUtf8(Path p, int maxBytes) throws IOException {
        byte[] b = Files.readAllBytes(p);
        if (b.length > maxBytes) throw new IOException(p + " is larger than " + maxBytes + " bytes");
        return new String(b, StandardCharsets.UTF_8);
    }

    /** Regular files directly inside {@code dir} whose names end with one of {@code exts}, sorted by file name. */
    public static List<Path> listFilesByExt(Path dir, Set<String> exts) throws IOException {
        List<Path> out = new ArrayList<>();
        if (!dirExists(dir)) return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                if (!Files.isRegularFile(p)) continue;
                String fn = p.getFileName().toString().toLowerCase(Locale.ROOT);
                for (String ext : exts) {
                    if (fn.endsWith(ext)) {
                        out.add(p);
                        break;
                    }
                }
            }
        }
        out.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return out;
    }

    public static String relativeUnixPath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    public static boolean dirExists(Path p) { return p != null && Files.exists(p) && Files.isDirectory(p); }
}
