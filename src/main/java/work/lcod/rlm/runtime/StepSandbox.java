package work.lcod.rlm.runtime;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.rlm.bundle.Bundle;
import work.lcod.rlm.bundle.Chunk;
import work.lcod.rlm.subcall.SubcallException;

/**
 * Evaluates one step of JavaScript in a fresh, locked-down polyglot context. Only the capability globals
 * installed here reach the bundle, the scratch memory and the subcall layer.
 *
 * <p>Only the guest's stdout is captured and capped. Guest stderr ({@code console.error}) goes to the log
 * at debug level and never counts toward {@code stdout_chars}.
 */
final class StepSandbox {
    private static final Logger log = LoggerFactory.getLogger(StepSandbox.class);
    private static final int DEFAULT_LIST_LIMIT = 20;
    private static final int DEFAULT_PEEK_CHARS = 200;
    private static final String STRIP_GLOBALS = String.join("\n",
        "for (const name of ['load', 'loadWithNewGlobal', 'quit', 'exit', 'Polyglot', 'Java', 'readline', 'readbuffer']) {",
        "  try { delete globalThis[name]; } catch (e) {}",
        "}"
    );

    private final Bundle bundle;
    private final Map<String, Object> contextInfo;
    private final ScratchMemory memory;
    private final SubcallHandler subcalls;
    private final Consumer<Object> finalizer;

    StepSandbox(
        Bundle bundle,
        Map<String, Object> contextInfo,
        ScratchMemory memory,
        SubcallHandler subcalls,
        Consumer<Object> finalizer
    ) {
        this.bundle = bundle;
        this.contextInfo = contextInfo;
        this.memory = memory;
        this.subcalls = subcalls;
        this.finalizer = finalizer;
    }

    record Outcome(StepError error, String stdout) {}

    Outcome execute(String code) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        StepError error = null;
        try (Context polyglot = Context
            .newBuilder("js")
            .out(out)
            .err(err)
            .allowHostAccess(HostAccess.EXPLICIT)
            .allowHostClassLookup(className -> false)
            .allowIO(false)
            .allowCreateProcess(false)
            .allowCreateThread(false)
            .allowNativeAccess(false)
            .allowPolyglotAccess(PolyglotAccess.NONE)
            .allowEnvironmentAccess(EnvironmentAccess.NONE)
            .option("engine.WarnInterpreterOnly", "false")
            .build()) {
            try {
                polyglot.eval("js", STRIP_GLOBALS);
                installGlobals(polyglot);
                polyglot.eval("js", code);
            } catch (PolyglotException ex) {
                error = describe(ex);
            }
        }
        if (err.size() > 0) {
            log.debug("Step wrote to stderr: {}", err.toString(StandardCharsets.UTF_8).strip());
        }
        return new Outcome(error, out.toString(StandardCharsets.UTF_8));
    }

    private void installGlobals(Context polyglot) {
        Value globals = polyglot.getBindings("js");
        globals.putMember("context", GuestValues.toGuest(polyglot, contextInfo));
        globals.putMember("memory", new MemoryProxy(polyglot, memory));
        globals.putMember("listChunks", (ProxyExecutable) args -> GuestValues.toGuest(
            polyglot,
            listChunks(optionalString(args, 0), intArg(args, 1, DEFAULT_LIST_LIMIT))
        ));
        globals.putMember("getChunk", (ProxyExecutable) args -> getChunk(requiredString(args, 0, "getChunk")));
        globals.putMember("peek", (ProxyExecutable) args -> {
            String text = getChunk(requiredString(args, 0, "peek"));
            int maxChars = Math.max(1, intArg(args, 1, DEFAULT_PEEK_CHARS));
            return prefix(text, maxChars);
        });
        globals.putMember("grep", (ProxyExecutable) args -> GuestValues.toGuest(
            polyglot,
            grep(requiredString(args, 0, "grep"), optionalString(args, 1), intArg(args, 2, DEFAULT_LIST_LIMIT))
        ));
        globals.putMember("finalize", (ProxyExecutable) args -> {
            Value value = args.length > 0 ? args[0] : null;
            finalizer.accept(GuestValues.toJava(value));
            return value;
        });
        globals.putMember("subcall", (ProxyExecutable) args -> {
            if (subcalls == null) {
                throw new SubcallException(
                    SubcallException.Reason.UNAVAILABLE,
                    "subcalls are not available in this run"
                );
            }
            String prompt = requiredString(args, 0, "subcall");
            return GuestValues.toGuest(polyglot, subcalls.query(prompt, optionalString(args, 1)));
        });
    }

    List<Map<String, Object>> listChunks(String source, int limit) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (limit <= 0) {
            return rows;
        }
        for (Chunk chunk : bundle.chunks()) {
            if (source != null && !chunk.source().equals(source)) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("char_count", chunk.charCount());
            row.put("chunk_id", chunk.chunkId());
            row.put("range", chunk.range());
            row.put("source", chunk.source());
            rows.add(row);
            if (rows.size() >= limit) {
                break;
            }
        }
        return rows;
    }

    String getChunk(String chunkId) {
        Chunk chunk = bundle.chunk(chunkId);
        if (chunk == null) {
            throw new UnknownChunkException(chunkId);
        }
        return chunk.text();
    }

    /**
     * Matches {@code pattern} against every line of every chunk; {@code line_no} is the line number within the
     * source file.
     */
    List<Map<String, Object>> grep(String pattern, String source, int limit) {
        Pattern regex = Pattern.compile(pattern);
        List<Map<String, Object>> rows = new ArrayList<>();
        if (limit <= 0) {
            return rows;
        }
        for (Chunk chunk : bundle.chunks()) {
            if (source != null && !chunk.source().equals(source)) {
                continue;
            }
            List<String> lines = chunk.text().lines().toList();
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (!regex.matcher(line).find()) {
                    continue;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("chunk_id", chunk.chunkId());
                row.put("line_no", Math.max(1, chunk.lineStart()) + i);
                row.put("line_text", line);
                row.put("source", chunk.source());
                rows.add(row);
                if (rows.size() >= limit) {
                    return rows;
                }
            }
        }
        return rows;
    }

    static StepError describe(PolyglotException ex) {
        if (ex.isHostException()) {
            Throwable host = ex.asHostException();
            return new StepError(host.getClass().getSimpleName(), host.getMessage());
        }
        if (ex.isSyntaxError()) {
            return new StepError("SyntaxError", ex.getMessage());
        }
        if (ex.isInternalError()) {
            return new StepError("InternalError", ex.getMessage());
        }
        Value guest = ex.getGuestObject();
        if (guest != null && guest.isString()) {
            return new StepError("Error", guest.asString());
        }
        if (guest != null && guest.hasMembers()) {
            Value name = guest.getMember("name");
            Value message = guest.getMember("message");
            String kind = name != null && name.isString() && !name.asString().isBlank() ? name.asString() : "Error";
            String text = message != null && message.isString() ? message.asString() : ex.getMessage();
            return new StepError(kind, text);
        }
        return new StepError("Error", ex.getMessage());
    }

    static String prefix(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    private static String requiredString(Value[] args, int index, String function) {
        String value = optionalString(args, index);
        if (value == null) {
            throw new IllegalArgumentException(function + " requires argument " + (index + 1));
        }
        return value;
    }

    private static String optionalString(Value[] args, int index) {
        if (args.length <= index || args[index] == null || args[index].isNull()) {
            return null;
        }
        Value value = args[index];
        return value.isString() ? value.asString() : value.toString();
    }

    private static int intArg(Value[] args, int index, int fallback) {
        if (args.length <= index || args[index] == null || args[index].isNull()) {
            return fallback;
        }
        Value value = args[index];
        if (value.isNumber()) {
            return value.fitsInInt() ? value.asInt() : (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value.asDouble()));
        }
        if (value.isString()) {
            try {
                return Integer.parseInt(value.asString().strip());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("expected an integer, got '" + value.asString() + "'", ex);
            }
        }
        throw new IllegalArgumentException("expected an integer, got " + value);
    }

    /** Raised to step code for a chunk id the bundle does not contain. */
    static final class UnknownChunkException extends RuntimeException {
        UnknownChunkException(String chunkId) {
            super("Unknown chunk_id '" + chunkId + "'");
        }
    }
}
