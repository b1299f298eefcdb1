package fun.ai.indexer.catalog;

import java.util.Collection;

/**
 * ShortId 分配：取 max(已存在最大序号, 历史高水位) + 1。
 * 本身无状态，调用方必须在与插入相同的锁内调用（读最大值与插入不可并发穿插）。
 */
public final class IdentifierAllocator {

    private IdentifierAllocator() {
    }

    public static ShortId next(EntryKind kind, Collection<String> existingIds, long highWater) {
        long max = Math.max(0L, highWater);
        if (existingIds != null) {
            for (String raw : existingIds) {
                ShortId id = ShortId.parse(raw);
                if (id != null && id.getKind() == kind && id.getNumber() > max) {
                    max = id.getNumber();
                }
            }
        }
        return new ShortId(kind, max + 1);
    }
}
