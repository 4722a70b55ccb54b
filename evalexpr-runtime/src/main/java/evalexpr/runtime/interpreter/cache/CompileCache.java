package evalexpr.runtime.interpreter.cache;

import com.evalexpr.compiler.tape.Tape;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Objects;
import java.util.function.Function;

/**
 * 基于 Caffeine 的编译结果缓存
 *
 * <p>键为（文件名，源码文本）。编译是确定性的，相同输入总得到相同的指令带，
 * 而指令带不可变，所以可以在多次执行之间共享。编译失败不会被缓存。</p>
 */
public final class CompileCache {

    private final Cache<Key, Tape> cache;
    private final long maximumSize;

    /**
     * @param maximumSize 最大条目数
     */
    public CompileCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * 取缓存的指令带，不存在则调用 {@code compiler} 编译并缓存
     */
    public Tape get(String fileName, String source, Function<String, Tape> compiler) {
        return cache.get(new Key(fileName, source), key -> compiler.apply(key.source));
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats s = cache.stats();
        return new CacheStats(s.hitCount(), s.missCount(), s.evictionCount(),
                cache.estimatedSize(), maximumSize);
    }

    private static final class Key {
        final String fileName;
        final String source;

        Key(String fileName, String source) {
            this.fileName = fileName;
            this.source = source;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return Objects.equals(fileName, key.fileName) && source.equals(key.source);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hashCode(fileName) + source.hashCode();
        }
    }
}
