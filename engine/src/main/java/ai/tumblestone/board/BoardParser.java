package ai.tumblestone.board;

import ai.tumblestone.board.BoardParseException.Kind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses the textual board format into a {@link Board}.
 * <p>
 * <strong>Format:</strong>
 * <pre>{@code
 * # comments start with '#'
 * width: 3
 * wild: RG
 * lock: false
 * color.R: 196
 * ---
 * R R R
 * G * G
 * }</pre>
 * The legend holds one {@code key: value} property per line up to the {@code ---}
 * separator. Every non-whitespace character after the separator is one tile in
 * row-major order:
 * <ul>
 *   <li>{@code .} empty</li>
 *   <li>{@code *} wild</li>
 *   <li>{@code #} survivor</li>
 *   <li>{@code O} toggle, open on turn zero</li>
 *   <li>{@code X} toggle, closed on turn zero</li>
 *   <li>anything else: an ordinary stone; each distinct glyph gets the next color bit</li>
 * </ul>
 * Wild glyphs are allocated color bits before the grid is read, so a wild color need
 * not appear on the board.
 */
public final class BoardParser {
    /** Separates the legend from the grid. */
    public static final String SEPARATOR = "---";

    /** Upper bound imposed by encoding each color as one bit of an {@code int}. */
    public static final int MAX_COLORS = Integer.SIZE;

    private static final String COLOR_PREFIX = "color.";

    private BoardParser() {
    }

    /**
     * Parses {@code text} into a fully validated board.
     *
     * @param text the contents of a board file
     * @return the board on turn zero
     * @throws BoardParseException if the text is malformed or describes an inconsistent board
     */
    public static Board parse(String text) throws BoardParseException {
        String[] lines = text.split("\\R", -1);
        Integer width = null;
        String wildGlyphs = "";
        int wildLine = 0;
        boolean colorLock = false;
        Map<Character, Integer> glyphColors = new LinkedHashMap<>();

        int lineIndex = 0;
        boolean separatorSeen = false;
        while (lineIndex < lines.length) {
            String line = lines[lineIndex].strip();
            int lineNumber = ++lineIndex;
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.equals(SEPARATOR)) {
                separatorSeen = true;
                break;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new BoardParseException(Kind.MALFORMED_LEGEND, lineNumber,
                        "expected 'key: value' but found '" + line + "'");
            }
            String key = line.substring(0, colon).strip().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).strip();
            switch (key) {
                case "width" -> width = parsePositiveInt(value, lineNumber);
                case "wild" -> {
                    wildGlyphs = value.replaceAll("\\s+", "");
                    wildLine = lineNumber;
                }
                case "lock" -> colorLock = parseBoolean(key, value, lineNumber);
                default -> {
                    if (!key.startsWith(COLOR_PREFIX)) {
                        throw new BoardParseException(Kind.UNKNOWN_PROPERTY, lineNumber,
                                "unknown property '" + key + "'");
                    }
                    // Glyph keys keep their case, so read it from the original line.
                    String glyph = line.substring(COLOR_PREFIX.length(), colon).strip();
                    if (glyph.length() != 1 || isReserved(glyph.charAt(0))) {
                        throw new BoardParseException(Kind.INVALID_PROPERTY, lineNumber,
                                "'" + glyph + "' is not an ordinary stone glyph");
                    }
                    glyphColors.put(glyph.charAt(0), parseAnsiColor(value, lineNumber));
                }
            }
        }
        if (!separatorSeen) {
            throw new BoardParseException(Kind.EMPTY_GRID, 0, "no '" + SEPARATOR + "' line before the grid");
        }
        if (width == null) {
            throw new BoardParseException(Kind.MISSING_PROPERTY, 0, "the 'width' property is required");
        }

        Map<Character, Integer> colors = new LinkedHashMap<>();
        int wildColors = 0;
        Set<Character> seenWild = new LinkedHashSet<>();
        for (char glyph : wildGlyphs.toCharArray()) {
            if (isReserved(glyph) || !seenWild.add(glyph)) {
                throw new BoardParseException(Kind.INVALID_PROPERTY, wildLine,
                        "wild colors must be distinct ordinary glyphs: '" + wildGlyphs + "'");
            }
            wildColors |= colorBit(colors, glyph, wildLine);
        }

        List<Tile> tiles = new ArrayList<>();
        int wilds = 0;
        for (; lineIndex < lines.length; lineIndex++) {
            String line = lines[lineIndex];
            for (int i = 0; i < line.length(); i++) {
                char glyph = line.charAt(i);
                if (Character.isWhitespace(glyph)) {
                    continue;
                }
                Tile tile = switch (glyph) {
                    case '.' -> Tile.EMPTY;
                    case '*' -> Tile.WILD;
                    case '#' -> Tile.SURVIVOR;
                    case 'O' -> new Tile.Toggle(0);
                    case 'X' -> new Tile.Toggle(1);
                    default -> new Tile.Ordinary(glyph, colorBit(colors, glyph, lineIndex + 1));
                };
                if (tile.kind() == Tile.Kind.WILD) {
                    wilds++;
                }
                tiles.add(tile);
            }
        }

        if (tiles.isEmpty()) {
            throw new BoardParseException(Kind.EMPTY_GRID, 0, "the grid holds no tiles");
        }
        if (tiles.size() % width != 0) {
            throw new BoardParseException(Kind.INCOMPLETE_GRID, 0, tiles.size()
                    + " tiles do not fill whole rows of width " + width);
        }
        if (wilds != Integer.bitCount(wildColors)) {
            throw new BoardParseException(Kind.WILD_COUNT_MISMATCH, wildLine, "the board has " + wilds
                    + " wild tiles but declares " + Integer.bitCount(wildColors) + " wild colors");
        }
        return new Board(width, wildColors, colorLock, tiles, glyphColors);
    }

    /**
     * Returns true if {@code glyph} denotes a tile other than an ordinary stone.
     */
    public static boolean isReserved(char glyph) {
        return glyph == '.' || glyph == '*' || glyph == '#' || glyph == 'O' || glyph == 'X'
                || Character.isWhitespace(glyph);
    }

    /**
     * Returns the color bit of {@code glyph}, allocating the next free bit on first use.
     */
    private static int colorBit(Map<Character, Integer> colors, char glyph, int lineNumber)
            throws BoardParseException {
        Integer bit = colors.get(glyph);
        if (bit != null) {
            return bit;
        }
        if (colors.size() >= MAX_COLORS) {
            throw new BoardParseException(Kind.TOO_MANY_COLORS, lineNumber,
                    "'" + glyph + "' would be color " + (colors.size() + 1) + " of at most " + MAX_COLORS);
        }
        bit = 1 << colors.size();
        colors.put(glyph, bit);
        return bit;
    }

    private static int parsePositiveInt(String value, int lineNumber) throws BoardParseException {
        int parsed = parseInt(value, lineNumber, "width");
        if (parsed <= 0) {
            throw new BoardParseException(Kind.INVALID_PROPERTY, lineNumber,
                    "width must be a positive integer: '" + value + "'");
        }
        return parsed;
    }

    private static int parseAnsiColor(String value, int lineNumber) throws BoardParseException {
        int parsed = parseInt(value, lineNumber, "display color");
        if (parsed < 0 || parsed > 255) {
            throw new BoardParseException(Kind.INVALID_PROPERTY, lineNumber,
                    "display color must be an ANSI 256-color index: '" + value + "'");
        }
        return parsed;
    }

    private static int parseInt(String value, int lineNumber, String what) throws BoardParseException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new BoardParseException(Kind.INVALID_PROPERTY, lineNumber,
                    what + " must be an integer: '" + value + "'");
        }
    }

    private static boolean parseBoolean(String key, String value, int lineNumber) throws BoardParseException {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new BoardParseException(Kind.INVALID_PROPERTY, lineNumber,
                    key + " must be true or false: '" + value + "'");
        };
    }
}
