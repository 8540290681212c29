package io.shotmatrix.automation;

import io.shotmatrix.config.Defaults;
import io.shotmatrix.device.CommandRunner;
import io.shotmatrix.error.ProvisioningException;
import io.shotmatrix.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Spawns {@code appium --port <port>} and polls {@code /status} until it is ready.
 */
public final class AppiumServerController implements AutomationServerController {
    private static final Logger log = LoggerFactory.getLogger(AppiumServerController.class);

    private final CommandRunner runner;
    private final String appiumBinary;
    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();
    private final Map<Integer, Process> servers = new ConcurrentHashMap<>();

    public AppiumServerController(CommandRunner runner) {
        this(runner, "appium");
    }

    public AppiumServerController(CommandRunner runner, String appiumBinary) {
        this.runner = runner;
        this.appiumBinary = appiumBinary;
    }

    public static URI urlFor(int port) {
        return URI.create("http://127.0.0.1:" + port);
    }

    @Override
    public URI start(int port, CancellationToken token) {
        URI url = urlFor(port);
        if (ready(url)) {
            log.info("Automation server already running at {}, reusing it", url);
            return url;
        }
        Process process;
        try {
            process = runner.start(List.of(appiumBinary, "--port", String.valueOf(port)));
        } catch (UncheckedIOException e) {
            throw new ProvisioningException("Failed to start appium on port " + port + ": " + e.getMessage(), e);
        }
        servers.put(port, process);
        long deadline = System.nanoTime() + Defaults.SERVER_START_TIMEOUT.toNanos();
        try {
            while (!ready(url)) {
                if (!process.isAlive()) {
                    throw new ProvisioningException("appium exited with code " + process.exitValue() + " on port " + port);
                }
                if (System.nanoTime() >= deadline) {
                    throw new ProvisioningException("appium on port " + port + " not ready within "
                            + Defaults.SERVER_START_TIMEOUT);
                }
                token.sleep(Duration.ofMillis(500));
            }
        } catch (RuntimeException e) {
            stop(port);
            throw e;
        }
        log.info("Automation server ready at {}", url);
        return url;
    }

    @Override
    public void stop(int port) {
        Process process = servers.remove(port);
        if (process == null) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        log.debug("Automation server on port {} stopped", port);
    }

    private boolean ready(URI url) {
        HttpRequest request = HttpRequest.newBuilder(url.resolve("/status"))
                .timeout(Duration.ofSeconds(2))
                .GET()
                .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200 && response.body().contains("\"value\"");
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
