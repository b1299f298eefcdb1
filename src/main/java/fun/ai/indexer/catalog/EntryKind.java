package fun.ai.indexer.catalog;

/**
 * 目录条目类型：每种类型一个独立的 ShortId 序列（单字符前缀）
 */
public enum EntryKind {
    /**
     * 可运行的 server 脚本 + 配套页面
     */
    EXECUTABLE('A'),
    /**
     * 独立静态页面
     */
    STATIC('B');

    private final char prefix;

    EntryKind(char prefix) {
        this.prefix = prefix;
    }

    public char getPrefix() {
        return prefix;
    }

    public static EntryKind fromPrefix(char c) {
        char upper = Character.toUpperCase(c);
        for (EntryKind k : values()) {
            if (k.prefix == upper) return k;
        }
        return null;
    }
}
