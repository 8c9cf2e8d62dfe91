package work.lcod.rlm.runtime;

import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * Exposes {@link ScratchMemory} to step code as the {@code memory} global. Reads hand out copies; only
 * assignment and {@code delete} change what is stored.
 *
 * <p>Mutating a value read from memory changes the copy only, so {@code memory.items.push(1)} is lost.
 * Step code reads the value, changes it and assigns it back: {@code const items = memory.items;
 * items.push(1); memory.items = items}.
 */
final class MemoryProxy implements ProxyObject {
    private final Context context;
    private final ScratchMemory memory;

    MemoryProxy(Context context, ScratchMemory memory) {
        this.context = context;
        this.memory = memory;
    }

    @Override
    public Object getMember(String key) {
        if (!memory.contains(key)) {
            return null;
        }
        return GuestValues.toGuest(context, memory.get(key));
    }

    @Override
    public Object getMemberKeys() {
        return ProxyArray.fromArray(memory.keys().toArray());
    }

    @Override
    public boolean hasMember(String key) {
        return memory.contains(key);
    }

    @Override
    public void putMember(String key, Value value) {
        memory.put(key, GuestValues.toJava(value));
    }

    @Override
    public boolean removeMember(String key) {
        return memory.remove(key);
    }

    Map<String, Object> snapshot() {
        return memory.snapshot();
    }
}
