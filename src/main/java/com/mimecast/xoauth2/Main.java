package com.mimecast.xoauth2;

import com.mimecast.xoauth2.config.AuthSourceConfig;
import com.mimecast.xoauth2.resolver.AuthenticationRecord;
import com.mimecast.xoauth2.resolver.CredentialResolver;
import com.mimecast.xoauth2.sasl.SaslXoauth2Encoder;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Resolves an identity and prints its access token, or the XOAUTH2 SASL initial
 * <br>response with <code>--sasl</code>. Suitable as a password command for mail clients.
 *
 * <p>Exit status: 0 resolved, 1 no credentials matched, 2 usage or resolution error.
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "xoauth2.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "XOAUTH2 access token resolver";

    static final int EXIT_OK = 0;
    static final int EXIT_NO_MATCH = 1;
    static final int EXIT_ERROR = 2;

    private final String[] args;
    private final PrintStream out;
    private int status = EXIT_ERROR;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        int status = new Main(args, System.out).getStatus();
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     * @param out  Output stream.
     */
    Main(String[] args, PrintStream out) {
        this.args = args;
        this.out = out;

        // Disable logging.
        Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);

        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);

        if (opt.isPresent()) {
            CommandLine cmd = opt.get();

            if (cmd.hasOption("debug")) {
                Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.DEBUG);
            }

            if (cmd.hasOption("config") && cmd.hasOption("host") && cmd.hasOption("port")) {
                status = run(cmd);
            }

            // Show usage.
            else {
                optionsUsage(options);
            }
        }
    }

    /**
     * Resolves and prints.
     *
     * @param cmd CommandLine instance.
     * @return Exit status.
     */
    private int run(CommandLine cmd) {
        List<String> hosts = Arrays.asList(cmd.getOptionValues("host"));
        List<String> ports = Arrays.asList(cmd.getOptionValues("port"));
        String user = cmd.getOptionValue("user");

        try {
            CredentialResolver resolver = new CredentialResolver(new AuthSourceConfig(cmd.getOptionValue("config")));
            Optional<AuthenticationRecord> record = resolver.resolve(hosts, user, ports);

            if (record.isEmpty()) {
                log("No credentials for " + hosts + " " + ports);
                return EXIT_NO_MATCH;
            }

            if (cmd.hasOption("sasl")) {
                log(SaslXoauth2Encoder.encodeToString(record.get().user(), record.get().secret()));
            } else {
                log(record.get().secret());
            }
            return EXIT_OK;

        } catch (IOException | AuthSourceException e) {
            log("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Path to auth-source.json5");
        options.addOption("h", "host", true, "Host to resolve, repeat to probe several in order");
        options.addOption("u", "user", true, "User name, defaults to the credentials user");
        options.addOption("p", "port", true, "Port or service, repeat to probe several in order");
        options.addOption(null, "sasl", false, "Print the XOAUTH2 SASL initial response instead of the token");
        options.addOption(null, "debug", false, "Enable debug logging");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            // Should not happen with ByteArrayOutputStream.
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Gets exit status.
     *
     * @return Integer.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        out.println(string);
    }
}
