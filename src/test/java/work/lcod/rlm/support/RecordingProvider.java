package work.lcod.rlm.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import work.lcod.rlm.subcall.ProviderClient;
import work.lcod.rlm.subcall.ProviderException;
import work.lcod.rlm.subcall.ProviderRequest;

/**
 * Provider client that replays scripted outcomes and remembers every request it saw. When the script runs
 * out it answers {@code "<name>: <prompt>"}.
 */
public final class RecordingProvider implements ProviderClient {
    private final String name;
    private final Deque<Object> script = new ArrayDeque<>();
    private final List<ProviderRequest> requests = new ArrayList<>();

    public RecordingProvider(String name) {
        this.name = name;
    }

    public RecordingProvider answer(String text) {
        script.add(text);
        return this;
    }

    public RecordingProvider fail(String message) {
        script.add(new ProviderException(message));
        return this;
    }

    public RecordingProvider crash(RuntimeException failure) {
        script.add(failure);
        return this;
    }

    public RecordingProvider failAlways() {
        script.clear();
        script.add(Boolean.FALSE);
        return this;
    }

    @Override
    public String complete(ProviderRequest request) throws ProviderException {
        requests.add(request);
        Object next = script.peek();
        if (Boolean.FALSE.equals(next)) {
            throw new ProviderException(name + " is down");
        }
        if (next != null) {
            script.poll();
        }
        if (next instanceof ProviderException failure) {
            throw failure;
        }
        if (next instanceof RuntimeException failure) {
            throw failure;
        }
        return next == null ? name + ": " + request.prompt() : (String) next;
    }

    public List<ProviderRequest> requests() {
        return requests;
    }

    public int calls() {
        return requests.size();
    }
}
