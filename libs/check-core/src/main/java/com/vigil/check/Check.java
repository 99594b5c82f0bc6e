package com.vigil.check;

import java.util.ArrayList;
import java.util.List;

/**
 * A single probe against a target (website, certificate, mail server, DNS record).
 * <p>
 * Implementations perform one blocking I/O exchange and shape the response into a
 * {@link CheckOutcome}. They may throw: the {@link CheckInvoker} converts every exception into an
 * error outcome, so implementations only need to catch what they want to report more precisely.
 * Implementations must be thread-safe; one instance serves every request of its type.
 * <p>
 * Example usage:
 * <pre>{@code
 * registry.register("tcp_port", config -> {
 *     try (Socket socket = new Socket()) {
 *         socket.connect(new InetSocketAddress(config.require("host"), config.getInt("port", 80)), 2000);
 *         return CheckOutcome.success("Port open", Duration.ZERO, Map.of());
 *     }
 * });
 * }</pre>
 */
@FunctionalInterface
public interface Check {

    /**
     * Runs the check with the given configuration.
     *
     * @param config the request's configuration
     * @return the outcome (must not be null)
     * @throws Exception any failure; converted to an error outcome by the invoker
     */
    CheckOutcome execute(CheckConfig config) throws Exception;

    /**
     * Describes this check for the catalogue. The default reports no documented configuration.
     *
     * @param type the tag this check is registered under
     */
    default CheckDescriptor descriptor(String type) {
        return CheckDescriptor.undocumented(type);
    }

    /**
     * Validates a configuration before {@link #execute} runs. The default requires every key of
     * {@link #descriptor(String) requiredConfig} to be present and non-null.
     *
     * @param type   the tag this check is registered under
     * @param config the request's configuration
     */
    default ValidationResult validate(String type, CheckConfig config) {
        List<String> errors = new ArrayList<>();
        for (String key : descriptor(type).requiredConfig()) {
            if (!config.has(key)) {
                errors.add("Missing required configuration: " + key);
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
