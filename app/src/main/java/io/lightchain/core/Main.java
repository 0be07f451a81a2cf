package io.lightchain.core;

import io.lightchain.core.consensus.NetworkParameters;
import io.lightchain.core.metrics.SpvMetrics;
import io.lightchain.core.node.SpvClient;
import io.lightchain.core.node.SpvConfig;
import io.lightchain.core.sync.Scripthashes;
import io.lightchain.core.verifier.AssetNames;
import io.lightchain.core.wallet.InMemoryWalletLedger;
import io.lightchain.core.wallet.WalletLedger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        SpvConfig config = options.toConfig();
        Files.createDirectories(config.dataDir);
        NetworkParameters params = NetworkParameters.forName(config.network);

        WalletLedger ledger = new InMemoryWalletLedger();
        for (String address : options.addresses()) {
            if (!Scripthashes.isAddress(address, params)) {
                throw new IllegalArgumentException("Not a " + params.name() + " address: " + address);
            }
            ledger.addAddress(address);
        }
        for (String asset : options.assets()) {
            if (!AssetNames.isValid(asset)) {
                throw new IllegalArgumentException("Not a valid asset name: " + asset);
            }
            ledger.addAsset(asset);
        }
        ledger.addListener(new WalletLedger.Listener() {
            @Override
            public void upToDateChanged(boolean upToDate) {
                LOG.info(() -> "wallet up to date: " + upToDate);
            }
        });

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "lightchain-shutdown"));

        try (SpvClient client = new SpvClient(config, params, ledger)) {
            client.setFailureListener(t -> shutdownLatch.countDown());
            client.start();
            LOG.info("Client running against " + config.serverHost + ":" + config.serverPort + ". Press CTRL+C to exit.");
            shutdownLatch.await();
            LOG.info("=== Metrics ===\n" + SpvMetrics.scrapeMetrics());
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configFile,
            Path dataDir,
            boolean testnet,
            String serverHost,
            int serverPort,
            boolean tls,
            List<String> addresses,
            List<String> assets
    ) {
        static CliOptions parse(String[] args) {
            Path configFile = envPath("LIGHTCHAIN_CONFIG", null);
            Path dataDir = envPath("LIGHTCHAIN_DATA_DIR", null);
            boolean testnet = "true".equalsIgnoreCase(System.getenv("LIGHTCHAIN_TESTNET"));
            boolean tls = "true".equalsIgnoreCase(System.getenv("LIGHTCHAIN_TLS"));
            String serverHost = null;
            int serverPort = -1;
            List<String> addresses = new ArrayList<>();
            List<String> assets = new ArrayList<>();
            boolean showHelp = false;
            String error = null;

            String serverEnv = System.getenv("LIGHTCHAIN_SERVER");
            if (serverEnv != null && !serverEnv.isBlank()) {
                try {
                    serverHost = parseHost(serverEnv, "LIGHTCHAIN_SERVER");
                    serverPort = parsePort(serverEnv.substring(serverEnv.lastIndexOf(':') + 1), "LIGHTCHAIN_SERVER");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.equals("--testnet")) {
                        testnet = true;
                    } else if (arg.equals("--tls")) {
                        tls = true;
                    } else if (arg.startsWith("--server=")) {
                        String value = arg.substring("--server=".length());
                        try {
                            serverHost = parseHost(value, "--server");
                            serverPort = parsePort(value.substring(value.lastIndexOf(':') + 1), "--server");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--address=")) {
                        addresses.add(arg.substring("--address=".length()).trim());
                    } else if (arg.startsWith("--asset=")) {
                        assets.add(arg.substring("--asset=".length()).trim());
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(
                    showHelp,
                    error,
                    configFile,
                    dataDir,
                    testnet,
                    serverHost,
                    serverPort,
                    tls,
                    List.copyOf(addresses),
                    List.copyOf(assets)
            );
        }

        /** Config file (or defaults) overridden by whatever the command line set. */
        SpvConfig toConfig() {
            SpvConfig config = configFile != null ? SpvConfig.load(configFile) : SpvConfig.defaultLocal();
            if (testnet) {
                config = config.withNetwork("testnet");
            }
            if (dataDir != null) {
                config = config.withDataDir(dataDir);
            } else if (configFile == null) {
                config = config.withDataDir(config.dataDir.resolve(config.network));
            }
            if (serverHost != null) {
                config = config.withServer(serverHost, serverPort, tls || config.tls);
            } else if (tls) {
                config = config.withServer(config.serverHost, config.serverPort, true);
            }
            return config;
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: lightchain [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for header files (default ./data/lightchain/<network>)
  --testnet                  Follow testnet instead of mainnet
  --server=<host:port>       Server to follow (default 127.0.0.1:50001)
  --tls                      Connect to the server over TLS
  --config=<file>            JSON config file; command line options win over it
  --address=<addr>           Watch an address (repeatable)
  --asset=<name>             Watch an asset (repeatable)

Environment overrides:
  LIGHTCHAIN_CONFIG          Override --config
  LIGHTCHAIN_DATA_DIR        Override --data-dir
  LIGHTCHAIN_SERVER          Server as host:port
  LIGHTCHAIN_TESTNET         Set to "true" to follow testnet
  LIGHTCHAIN_TLS             Set to "true" to use TLS
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String parseHost(String endpoint, String flag) {
            int colon = endpoint.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Expected host:port for " + flag + ": " + endpoint);
            }
            return endpoint.substring(0, colon);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}
