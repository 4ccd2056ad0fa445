package io.skipkp.cli;

import io.skipkp.config.KeyProviderConfig;
import io.skipkp.config.KeyProviderConfigLoader;
import io.skipkp.http.KeyProviderServer;
import io.skipkp.runtime.KeyProviderRuntime;
import io.skipkp.sync.SyncOutcome;
import io.skipkp.sync.SyncScheduler;
import io.skipkp.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "skip-kp",
        mixinStandardHelpOptions = true,
        description = "SKIP key provider node",
        subcommands = {
                KeyProviderCommand.ServeCommand.class,
                KeyProviderCommand.CheckConfigCommand.class,
                KeyProviderCommand.SyncOnceCommand.class,
                KeyProviderCommand.HealthCommand.class,
                KeyProviderCommand.AuditVerifyCommand.class
        }
)
public final class KeyProviderCommand implements Runnable {

    @Option(names = {"--config"}, description = "Settings file (default: ./skip-kp.json when present)")
    String configFile;

    @Option(names = {"--data-dir"}, description = "Override the data directory")
    String dataDir;

    @Option(names = {"--port"}, description = "Override the listen port")
    Integer port;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | check-config | sync-once | health | audit-verify");
    }

    KeyProviderConfig config() {
        Path file;
        if (configFile != null && !configFile.isBlank()) {
            file = Paths.get(configFile);
        } else {
            Path fallback = Paths.get(KeyProviderConfigLoader.DEFAULT_FILE_NAME);
            file = Files.exists(fallback) ? fallback : null;
        }
        return new KeyProviderConfigLoader().load(
                file,
                dataDir == null || dataDir.isBlank() ? null : Paths.get(dataDir),
                port
        );
    }

    KeyProviderRuntime runtime() {
        return new KeyProviderRuntime(config());
    }

    @Command(name = "serve", description = "Run the HTTP endpoints and the peer sync scheduler")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        KeyProviderCommand parent;

        @Override
        public Integer call() throws Exception {
            KeyProviderConfig config = parent.config();
            KeyProviderRuntime runtime = new KeyProviderRuntime(config);
            runtime.start();
            KeyProviderServer server = new KeyProviderServer(runtime, config.host(), config.port());
            server.start();
            System.out.println("SKIP key provider " + config.localSystemId() + " listening on " + server.baseUrl()
                    + " peers=" + config.peers().size());

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                System.out.println("Shutting down " + config.localSystemId());
                server.stop();
                runtime.stop();
                stopped.countDown();
            }, "skip-kp-shutdown-hook"));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "check-config", description = "Validate the settings and print the resolved values")
    static final class CheckConfigCommand implements Callable<Integer> {
        @ParentCommand
        KeyProviderCommand parent;

        @Override
        public Integer call() {
            try {
                KeyProviderConfig config = parent.config();
                System.out.println(Jsons.toJson(summary(config)));
                return 0;
            } catch (KeyProviderConfigLoader.InvalidConfigException e) {
                for (String error : e.errors()) {
                    System.err.println("ERROR " + error);
                }
                return 2;
            }
        }

        private static Map<String, Object> summary(KeyProviderConfig config) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("localSystemID", config.localSystemId());
            out.put("listen", config.host() + ":" + config.port());
            out.put("dataDir", config.dataDir().toString());
            out.put("remoteSystemID", config.remoteSystemIds());
            out.put("keySizeBits", Map.of(
                    "default", config.defaultKeySizeBits(),
                    "min", config.minKeySizeBits(),
                    "max", config.maxKeySizeBits()
            ));
            out.put("keyTtlSeconds", config.keyTtl().toSeconds());
            out.put("syncEnabled", config.syncEnabled());
            // PeerConfig.toString omits the shared secret.
            out.put("peers", config.peers().stream().map(Object::toString).toList());
            return out;
        }
    }

    @Command(name = "sync-once", description = "Run one heartbeat and one replication cycle against every peer")
    static final class SyncOnceCommand implements Callable<Integer> {
        @ParentCommand
        KeyProviderCommand parent;

        @Option(names = {"--sweep"}, defaultValue = "false", description = "Also run the expiry sweep")
        boolean sweep;

        @Override
        public Integer call() {
            try (KeyProviderRuntime runtime = parent.runtime()) {
                runtime.init();
                SyncScheduler scheduler = runtime.scheduler();
                List<SyncOutcome> heartbeats = scheduler.runHeartbeatsOnce();
                List<SyncScheduler.ReplicationReport> replication = scheduler.runReplicationOnce();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("heartbeats", heartbeats);
                out.put("replication", replication);
                if (sweep) {
                    out.put("swept", scheduler.runSweepOnce());
                }
                System.out.println(Jsons.toJson(out));
                boolean allDelivered = heartbeats.stream().allMatch(SyncOutcome::delivered);
                return allDelivered ? 0 : 1;
            }
        }
    }

    @Command(name = "health", description = "Print storage health")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        KeyProviderCommand parent;

        @Override
        public Integer call() {
            try (KeyProviderRuntime runtime = parent.runtime()) {
                runtime.init();
                KeyProviderRuntime.HealthOutcome out = runtime.health();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        KeyProviderCommand parent;

        @Override
        public Integer call() {
            KeyProviderConfig config = parent.config();
            try (KeyProviderRuntime runtime = new KeyProviderRuntime(config)) {
                boolean ok = runtime.auditLogger().verifyChain();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("auditFile", config.auditFile().toString());
                out.put("valid", ok);
                out.put("lastHash", runtime.auditLogger().currentHash());
                System.out.println(Jsons.toJson(out));
                return ok ? 0 : 1;
            }
        }
    }
}
