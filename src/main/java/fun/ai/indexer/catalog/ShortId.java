package fun.ai.indexer.catalog;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 短 ID：前缀 + 十进制序号。展示形态补零到 3 位（A001），预览图文件名补零到 5 位（A00001）。
 */
public final class ShortId implements Comparable<ShortId> {

    private static final Pattern FORMAT = Pattern.compile("^([A-Za-z])(\\d+)$");

    private final EntryKind kind;
    private final long number;

    public ShortId(EntryKind kind, long number) {
        if (kind == null) {
            throw new IllegalArgumentException("kind 不能为空");
        }
        if (number <= 0) {
            throw new IllegalArgumentException("number 必须为正数: " + number);
        }
        this.kind = kind;
        this.number = number;
    }

    /**
     * 解析 "A001" 这类文本；格式不符或前缀未知时返回 null
     */
    public static ShortId parse(String text) {
        if (text == null) return null;
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) return null;
        EntryKind kind = EntryKind.fromPrefix(m.group(1).charAt(0));
        if (kind == null) return null;
        try {
            long n = Long.parseLong(m.group(2));
            return n > 0 ? new ShortId(kind, n) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 预览图文件名主干：可解析则按 5 位补零，否则原样返回
     */
    public static String toFileStem(String text) {
        ShortId id = parse(text);
        return id == null ? text : id.fileStem();
    }

    public EntryKind getKind() {
        return kind;
    }

    public long getNumber() {
        return number;
    }

    public String display() {
        return kind.getPrefix() + String.format("%03d", number);
    }

    public String fileStem() {
        return kind.getPrefix() + String.format("%05d", number);
    }

    @Override
    public int compareTo(ShortId o) {
        int c = kind.compareTo(o.kind);
        return c != 0 ? c : Long.compare(number, o.number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShortId)) return false;
        ShortId other = (ShortId) o;
        return number == other.number && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number);
    }

    @Override
    public String toString() {
        return display();
    }
}
