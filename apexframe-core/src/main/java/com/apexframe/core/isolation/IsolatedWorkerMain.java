package com.apexframe.core.isolation;

import com.apexframe.api.action.ActionResult;
import com.apexframe.api.action.ChunkSource;
import com.apexframe.api.exception.ApexException;
import com.apexframe.api.exception.ErrorKind;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.extension.ApexExtension;
import com.apexframe.core.context.CoreExtensionContext;
import com.apexframe.core.event.EventBus;
import com.apexframe.core.event.ScopedEventChannel;
import com.apexframe.core.loader.ExtensionLoader;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.manifest.ManifestParser;
import com.apexframe.core.state.FileStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 隔离进程入口
 * <p>
 * 参数：清单文件、扩展目录、状态根目录、逗号分隔的已授予权限。
 * 标准输出只承载协议；日志在重定向之后才初始化，因此全部写入标准错误。
 * </p>
 */
public final class IsolatedWorkerMain {

    private final PrintStream protocol;
    private final Logger log;
    private ApexExtension instance;
    private ChunkSource<?> openSource;

    private IsolatedWorkerMain(PrintStream protocol) {
        this.protocol = protocol;
        this.log = LoggerFactory.getLogger(IsolatedWorkerMain.class);
    }

    public static void main(String[] args) {
        PrintStream protocol = System.out;
        System.setOut(System.err);
        int code = new IsolatedWorkerMain(protocol).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        if (args.length < 3) {
            reply(WorkerMessage.error(ErrorKind.FATAL.name(), null,
                    "usage: IsolatedWorkerMain <manifest> <extensionDir> <stateRoot> [permissions]"));
            return 2;
        }
        Path manifestFile = Paths.get(args[0]);
        Path extensionDir = Paths.get(args[1]);
        Path stateRoot = Paths.get(args[2]);
        Set<String> granted = new LinkedHashSet<>();
        if (args.length > 3 && !args[3].isBlank()) {
            granted.addAll(Arrays.asList(args[3].split(",")));
        }

        ExtensionLoader loader = new ExtensionLoader();
        String extensionId;
        try {
            ExtensionManifest manifest = ManifestParser.parse(manifestFile);
            extensionId = manifest.getId();
            EventBus bus = new EventBus();
            bus.subscribe(EventBus.WILDCARD, Integer.MIN_VALUE, extensionId, "host",
                    event -> reply(WorkerMessage.event(event.getType(), event.getPayload())));
            ScopedEventChannel channel = new ScopedEventChannel(extensionId, bus, () -> granted);
            CoreExtensionContext context = new CoreExtensionContext(manifest,
                    new FileStateStore(stateRoot).access(extensionId), channel);

            instance = loader.load(manifest, extensionDir, context).instance();
            instance.onInitialize(context);
            instance.onStart();
        } catch (Exception e) {
            log.error("Worker bootstrap failed", e);
            reply(error(e));
            loader.close();
            return 1;
        }
        log.info("[{}] Isolated worker ready", extensionId);
        reply(WorkerMessage.of(WorkerMessage.READY));

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerMessage request = WorkerMessage.parse(line);
                if (request.is(WorkerMessage.TERMINATE)) {
                    break;
                }
                handle(request);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.error("[{}] Protocol failure", extensionId, e);
        } finally {
            closeOpenSource();
            shutdown(extensionId);
            loader.close();
        }
        return 0;
    }

    private void handle(WorkerMessage request) {
        switch (request.type()) {
            case WorkerMessage.INVOKE:
                invoke(request);
                break;
            case WorkerMessage.NEXT:
                next();
                break;
            case WorkerMessage.CANCEL:
                closeOpenSource();
                reply(WorkerMessage.of(WorkerMessage.END));
                break;
            default:
                reply(WorkerMessage.error(ErrorKind.ACTION_FAILED.name(), null, "Unknown request " + request.type()));
        }
    }

    private void invoke(WorkerMessage request) {
        closeOpenSource();
        try {
            ActionResult result = instance.dispatch(request.action(),
                    request.input() == null ? Map.of() : request.input());
            if (result == null) {
                reply(WorkerMessage.error(ErrorKind.ACTION_FAILED.name(), null,
                        "Action '" + request.action() + "' returned null"));
            } else if (result instanceof ActionResult.Streamed streamed) {
                openSource = streamed.source();
                reply(WorkerMessage.of(WorkerMessage.STREAM));
            } else {
                reply(WorkerMessage.value(((ActionResult.Value) result).value()));
            }
        } catch (Exception e) {
            reply(error(e));
        }
    }

    private void next() {
        if (openSource == null) {
            reply(WorkerMessage.error(ErrorKind.STREAM_CONSUMPTION.name(), null, "No open stream"));
            return;
        }
        try {
            Optional<?> chunk = openSource.pull();
            if (chunk == null || chunk.isEmpty()) {
                closeOpenSource();
                reply(WorkerMessage.of(WorkerMessage.END));
            } else {
                reply(WorkerMessage.chunk(chunk.get()));
            }
        } catch (Exception e) {
            closeOpenSource();
            reply(error(e));
        }
    }

    private void closeOpenSource() {
        ChunkSource<?> source = openSource;
        openSource = null;
        if (source != null) {
            try {
                source.close();
            } catch (RuntimeException e) {
                log.warn("Chunk source failed to close", e);
            }
        }
    }

    private void shutdown(String extensionId) {
        try {
            instance.onStop();
            instance.onUnload();
        } catch (RuntimeException e) {
            log.warn("[{}] Extension failed during worker shutdown", extensionId, e);
        }
    }

    private WorkerMessage error(Exception e) {
        if (e instanceof ResourceLimitExceededException limit) {
            return WorkerMessage.error(limit.getKind().name(), limit.getLimitType().name(), limit.getMessage());
        }
        if (e instanceof ApexException apex) {
            return WorkerMessage.error(apex.getKind().name(), null, apex.getMessage());
        }
        return WorkerMessage.error(ErrorKind.ACTION_FAILED.name(), null, e.toString());
    }

    private void reply(WorkerMessage message) {
        String line;
        try {
            line = message.toLine();
        } catch (IllegalArgumentException e) {
            line = WorkerMessage.error(ErrorKind.ACTION_FAILED.name(), null, e.getMessage()).toLine();
        }
        synchronized (protocol) {
            protocol.println(line);
            protocol.flush();
        }
    }
}
