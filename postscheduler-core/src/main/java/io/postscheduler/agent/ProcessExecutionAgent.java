package io.postscheduler.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.postscheduler.ExecutionAgent;
import io.postscheduler.core.AgentRequest;
import io.postscheduler.core.AgentResult;
import io.postscheduler.exception.AgentExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs the browser automation as an external process, one process per post.
 *
 * <p>The request is written to the process's stdin as a single JSON object. Exit code 0 means the
 * post went out; any other exit code is a failure whose message is the tail of the process output.
 * A process may instead print an {@link AgentResult} JSON object as its last output line, which then
 * takes precedence over the exit code.
 *
 * <p>The scheduler bounds the call with its agent timeout and interrupts the waiting thread on expiry;
 * the process is then killed.
 */
public class ProcessExecutionAgent implements ExecutionAgent {
    private static final Logger log = LoggerFactory.getLogger(ProcessExecutionAgent.class);

    static final int MAX_OUTPUT_TAIL = 500;

    private final List<String> command;
    private final Path workingDirectory;
    private final ObjectMapper objectMapper;

    public ProcessExecutionAgent(List<String> command, Path workingDirectory, ObjectMapper objectMapper) {
        Objects.requireNonNull(command, "command must not be null");
        if (command.isEmpty() || command.get(0) == null || command.get(0).isBlank()) {
            throw new IllegalArgumentException("command must name an executable");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public AgentResult execute(AgentRequest request) throws Exception {
        Objects.requireNonNull(request, "request must not be null");

        Path output = Files.createTempFile("postscheduler-agent-", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());

            log.info("launching execution agent jobId={} command={}", request.jobId(), command.get(0));
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new AgentExecutionException("Failed to launch execution agent: " + e.getMessage(), e);
            }

            writeRequest(process, request);

            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                log.warn("execution agent interrupted; process killed jobId={}", request.jobId());
                throw e;
            }

            // decoded leniently: agent consoles do not always print UTF-8
            String out = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
            AgentResult reported = reportedResult(out);
            if (reported != null) {
                log.info("execution agent finished jobId={} exitCode={} reportedSuccess={}",
                        request.jobId(), exitCode, reported.success());
                return reported;
            }

            log.info("execution agent finished jobId={} exitCode={}", request.jobId(), exitCode);
            if (exitCode == 0) {
                return AgentResult.succeeded();
            }
            String tail = tail(out.strip(), MAX_OUTPUT_TAIL);
            return AgentResult.failure(tail.isEmpty()
                    ? "Execution agent exited with code " + exitCode
                    : tail);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.warn("could not delete agent output file path={} msg={}", output, e.getMessage());
            }
        }
    }

    private void writeRequest(Process process, AgentRequest request) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(objectMapper.writeValueAsBytes(request));
            stdin.write('\n');
        } catch (IOException e) {
            // the process may exit without reading its input
            log.debug("could not write request to execution agent jobId={} msg={}", request.jobId(), e.getMessage());
        }
    }

    AgentResult reportedResult(String output) {
        String last = lastNonBlankLine(output);
        if (last == null || !last.startsWith("{") || !last.contains("\"success\"")) {
            return null;
        }
        try {
            return objectMapper.readValue(last, AgentResult.class);
        } catch (JsonProcessingException e) {
            log.debug("last agent output line is not a result object msg={}", e.getOriginalMessage());
            return null;
        }
    }

    private static String lastNonBlankLine(String output) {
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (!line.isEmpty()) {
                return line;
            }
        }
        return null;
    }

    static String tail(String value, int max) {
        if (value.length() <= max) {
            return value;
        }
        return value.substring(value.length() - max);
    }
}
