package io.codesync.document;

/**
 * Identifies one replicated document: the owning session and a file path inside it.
 * Rendered and parsed as {@code sessionId:filePath}.
 */
public record DocumentKey(String sessionId, String filePath) {

    public static final int MAX_LENGTH = 1024;

    public DocumentKey {
        validateSession(sessionId);
        validatePath(filePath);
    }

    /**
     * Parses an already URL-decoded key. The session id ends at the first {@code ':'}.
     *
     * @throws InvalidDocumentKeyException if the key is missing, too long, contains control
     *                                     characters, or has an empty or relative path segment
     */
    public static DocumentKey parse(final String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidDocumentKeyException("Document key is empty");
        }
        if (raw.length() > MAX_LENGTH) {
            throw new InvalidDocumentKeyException("Document key longer than " + MAX_LENGTH + " characters");
        }

        final int sep = raw.indexOf(':');
        if (sep < 0) {
            throw new InvalidDocumentKeyException("Document key has no ':' separator: " + printable(raw));
        }
        return new DocumentKey(raw.substring(0, sep), raw.substring(sep + 1));
    }

    @Override
    public String toString() {
        return sessionId + ":" + filePath;
    }

    private static void validateSession(final String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            throw new InvalidDocumentKeyException("Session id is empty");
        }
        if (sessionId.indexOf(':') >= 0) {
            throw new InvalidDocumentKeyException("Session id contains ':': " + printable(sessionId));
        }
        rejectControlCharacters(sessionId);
    }

    private static void validatePath(final String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            throw new InvalidDocumentKeyException("File path is empty");
        }
        rejectControlCharacters(filePath);

        for (final String segment : filePath.split("/", -1)) {
            if (segment.isEmpty()) {
                throw new InvalidDocumentKeyException("File path has an empty segment: " + filePath);
            }
            if (segment.equals(".") || segment.equals("..")) {
                throw new InvalidDocumentKeyException("File path has a relative segment: " + filePath);
            }
        }
    }

    private static void rejectControlCharacters(final String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                throw new InvalidDocumentKeyException("Document key contains control characters: " + printable(value));
            }
        }
    }

    private static String printable(final String value) {
        final StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length() && i < 64; i++) {
            final char c = value.charAt(i);
            sb.append(Character.isISOControl(c) ? '?' : c);
        }
        return sb.toString();
    }
}
