package com.example.drivetransfer.destination;

/**
 * Builds Drive {@code files.list} filter expressions.
 */
public final class DriveQueries {

    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";

    private DriveQueries() {
    }

    /**
     * Escapes a value for use inside a single-quoted query string literal.
     * Backslash must go first so the quote escapes are not doubled.
     */
    public static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    public static String folderQuery(String name, String parentId) {
        String query = "mimeType='" + FOLDER_MIME_TYPE + "' and name='" + escape(name) + "' and trashed=false";
        if (parentId != null) {
            query += " and '" + escape(parentId) + "' in parents";
        }
        return query;
    }

    public static String entryQuery(String name, String parentId) {
        return "name='" + escape(name) + "' and '" + escape(parentId) + "' in parents and trashed=false";
    }
}
