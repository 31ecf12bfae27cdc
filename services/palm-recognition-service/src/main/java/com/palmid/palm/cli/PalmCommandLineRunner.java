package com.palmid.palm.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.palmid.common.exception.ErrorCode;
import com.palmid.palm.dto.PalmCommandResponse;
import com.palmid.palm.service.PalmRecognitionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command surface of the palm service:
 * <pre>
 * register  &lt;image_path&gt; &lt;identity&gt;
 * recognize &lt;image_path&gt; [identity|-] [threshold]
 * delete    &lt;identity&gt;
 * list
 * </pre>
 * Prints one JSON document to stdout. Exit code is 0 for any completed command, including
 * a non-match or a rejected registration, and 1 for usage errors or unexpected failures.
 */
@Component
@Slf4j
public class PalmCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String OPEN_SET = "-";

    private final PalmRecognitionService palmRecognitionService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public PalmCommandLineRunner(PalmRecognitionService palmRecognitionService, ObjectMapper objectMapper) {
        this(palmRecognitionService, objectMapper, System.out);
    }

    PalmCommandLineRunner(PalmRecognitionService palmRecognitionService, ObjectMapper objectMapper, PrintStream out) {
        this.palmRecognitionService = palmRecognitionService;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.out = out;
    }

    @Override
    public void run(String... args) {
        List<String> arguments = Arrays.stream(args)
            .filter(arg -> !arg.startsWith("--"))
            .collect(Collectors.toList());

        PalmCommandResponse response;
        try {
            response = execute(arguments);
        } catch (UsageException e) {
            exitCode = EXIT_FAILURE;
            response = PalmCommandResponse.failure(e.getMessage(), ErrorCode.SYS_USAGE_ERROR.getCode());
        } catch (RuntimeException e) {
            log.error("Unexpected failure running palm command {}", arguments.isEmpty() ? "" : arguments.get(0), e);
            exitCode = EXIT_FAILURE;
            response = PalmCommandResponse.failure("Error: " + e.getMessage(), ErrorCode.SYS_INTERNAL_ERROR.getCode());
        }
        print(response);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    PalmCommandResponse execute(List<String> arguments) {
        if (arguments.isEmpty()) {
            throw new UsageException("Missing command. Usage: <command> [args...]");
        }
        String command = arguments.get(0);
        log.debug("Command: {} with {} argument(s)", command, arguments.size() - 1);

        switch (command) {
            case "register":
                if (arguments.size() < 3) {
                    throw new UsageException("Usage: register <image_path> <identity>");
                }
                return palmRecognitionService.register(toPath(arguments.get(1)), arguments.get(2));
            case "recognize":
                if (arguments.size() < 2) {
                    throw new UsageException("Usage: recognize <image_path> [identity|-] [threshold]");
                }
                String identity = arguments.size() > 2 && !OPEN_SET.equals(arguments.get(2)) ? arguments.get(2) : null;
                Double threshold = arguments.size() > 3 ? parseThreshold(arguments.get(3)) : null;
                return palmRecognitionService.recognize(toPath(arguments.get(1)), identity, threshold);
            case "delete":
                if (arguments.size() < 2) {
                    throw new UsageException("Usage: delete <identity>");
                }
                return palmRecognitionService.delete(arguments.get(1));
            case "list":
                return palmRecognitionService.list();
            default:
                throw new UsageException("Unknown command: " + command
                    + ". Valid commands: register, recognize, delete, list");
        }
    }

    private static Path toPath(String value) {
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            throw new UsageException("Invalid image path: " + value);
        }
    }

    private static Double parseThreshold(String value) {
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new UsageException("Threshold must be a number: " + value);
        }
    }

    private void print(PalmCommandResponse response) {
        try {
            out.println(objectMapper.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize palm command result", e);
            exitCode = EXIT_FAILURE;
            out.println("{\"success\": false, \"message\": \"Failed to serialize result\"}");
        }
        out.flush();
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
