package me.golemcore.scheduler.domain.service;

/**
 * File name helpers shared by run records and result snapshots.
 */
final class FileNames {

    private static final String INVALID = "<>:\"/\\|?*";

    private FileNames() {
    }

    /**
     * Replace characters that are not allowed in file names on common
     * filesystems with underscores.
     */
    static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            sb.append(c < 32 || INVALID.indexOf(c) >= 0 ? '_' : c);
        }
        return sb.toString();
    }
}
