package io.catalogconnector.client;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterDescription;
import com.beust.jcommander.ParameterException;

import io.catalogconnector.client.catalog.DataCatalogFactory;
import io.catalogconnector.client.catalog.DataCatalogs;

public class CatalogConnectorClient {
    private static final Logger log = LoggerFactory.getLogger(CatalogConnectorClient.class);

    static final String PROGRAM_NAME = "catalog-connector-client";
    static final String PROVIDER_NAME = "openapi";

    static final String REQUEST_PAYLOAD_OPTION = "--request-payload";
    static final String OPERATION_TYPE_OPTION = "--operation-type";
    static final String CREDENTIALS_OPTION = "--creds";
    static final String URL_OPTION = "--url";

    /** Options that must be given together, or not at all. */
    private static final List<String> connectionOptions =
        Arrays.asList(REQUEST_PAYLOAD_OPTION, OPERATION_TYPE_OPTION, CREDENTIALS_OPTION, URL_OPTION);

    static class Options {
        @Parameter(names = {"-h", "--help"}, description = "Print usage", help = true)
        public boolean help;

        @Parameter(names = "--version", description = "Print the version")
        public boolean version;

        @Parameter(names = REQUEST_PAYLOAD_OPTION, description = "Json file containing the payload of the request", arity = 1,
            validateWith = FileValidator.class)
        public String requestFile = "resources/read-request.json";

        @Parameter(names = OPERATION_TYPE_OPTION, description = "Request operation. valid options are get-asset or create-asset", arity = 1)
        public String operation = Operation.GET_ASSET.operationName();

        @Parameter(names = CREDENTIALS_OPTION, description = "Credential path", arity = 1)
        public String credentialPath = "/v1/kubernetes-secrets/my-secret?namespace=default";

        @Parameter(names = URL_OPTION, description = "Catalog connector Url", arity = 1)
        public String connectorUrl = "http://localhost:8080";

        @Parameter(names = "--taxonomy", description = "Taxonomy file holding the response definitions", arity = 1)
        public String taxonomyFile = TaxonomyReference.DEFAULT_TAXONOMY_FILE;

        @Parameter(names = "--timeout", description = "Catalog connector timeout in seconds", arity = 1,
            validateWith = PositiveValidator.class)
        public int timeoutSeconds = 30;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Parses the arguments and runs one conformance check.
     *
     * @return the process exit status, 0 when the connector response passed validation
     */
    static int run(String... args) {
        Options options = new Options();
        JCommander commander = JCommander.newBuilder()
            .addObject(options)
            .programName(PROGRAM_NAME)
            .build();
        try {
            commander.parse(args);
            checkRequiredTogether(commander);
        }
        catch (ParameterException e) {
            log.error(e.getMessage());
            if (!(e instanceof ParameterValidationException)) {
                commander.usage();
            }
            return 1;
        }
        if (options.help) {
            commander.usage();
            return 0;
        }
        if (options.version) {
            System.out.println(PROGRAM_NAME + " " + version());
            return 0;
        }

        try {
            byte[] request = readRequest(options.requestFile);
            DataCatalogFactory catalogs = DataCatalogs.factory(
                PROVIDER_NAME, options.connectorUrl, Duration.ofSeconds(options.timeoutSeconds));
            Validator validator = new TaxonomyValidator(new FileTaxonomyStore());
            new Dispatcher(catalogs, validator, options.taxonomyFile)
                .run(options.operation, request, options.credentialPath);
            return 0;
        }
        catch (ConformanceException | IOException e) {
            log.error("request failed", e);
            return 1;
        }
        catch (RuntimeException e) {
            log.error("Unexpected error", e);
            return 1;
        }
    }

    private static byte[] readRequest(String requestFile) throws IOException {
        try {
            byte[] request = Files.readAllBytes(Paths.get(requestFile));
            log.info("Successfully Opened " + requestFile);
            return request;
        }
        catch (IOException e) {
            throw new IOException("error opening " + requestFile, e);
        }
    }

    private static void checkRequiredTogether(JCommander commander) {
        List<String> given = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (ParameterDescription description : commander.getParameters()) {
            String name = description.getLongestName();
            if (connectionOptions.contains(name)) {
                (description.isAssigned() ? given : missing).add(name);
            }
        }
        if (!given.isEmpty() && !missing.isEmpty()) {
            throw new ParameterValidationException("if any flags in the group " + connectionOptions
                + " are set they must all be set; missing " + missing);
        }
    }

    private static String version() {
        @Nullable String version = CatalogConnectorClient.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version.trim();
    }

    public static class FileValidator implements IParameterValidator {
        public void validate(String name, String value) throws ParameterException {
            if (!new File(value).exists()) {
                throw new ParameterValidationException("File " + value + " does not exist.");
            }
        }
    }

    public static class PositiveValidator implements IParameterValidator {
        public void validate(String name, String value) throws ParameterException {
            try {
                if (Integer.parseInt(value) <= 0) {
                    throw new ParameterValidationException(name + " must be positive, got " + value);
                }
            }
            catch (NumberFormatException e) {
                throw new ParameterValidationException(name + " must be a number, got " + value);
            }
        }
    }

    public static class ParameterValidationException extends ParameterException {
        public ParameterValidationException(String message) {
            super(message);
        }
    }
}
