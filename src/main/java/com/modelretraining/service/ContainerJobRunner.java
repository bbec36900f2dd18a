package com.modelretraining.service;

import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.model.ResourceRequirement;
import com.modelretraining.model.TrainingJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Runs a job's container command in a throwaway docker container whose CPU and
 * memory are capped at the job's requirement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContainerJobRunner {

    static final int OUTPUT_TAIL_CHARS = 500;

    private final RetrainingSettings settings;

    public void run(TrainingJob job, ResourceRequirement requirement) throws IOException, InterruptedException {
        List<String> command = buildCommand(job, requirement);
        log.info("Container job starting | jobId={} | image={} | cpus={} | memoryMb={}",
                 job.getJobId(), settings.getContainerImage(), requirement.cpuCores(), requirement.memoryMb());

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        OutputTail output = new OutputTail(OUTPUT_TAIL_CHARS);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[CONTAINER {}] {}", job.getJobId(), line);
                output.append(line);
            }
        }

        int exitCode = process.waitFor();
        if (exitCode != 0) {
            throw new IllegalStateException("Container job " + job.getJobId() + " exited with code " + exitCode
                + "\nOutput:\n" + output);
        }
        log.info("Container job finished | jobId={}", job.getJobId());
    }

    List<String> buildCommand(TrainingJob job, ResourceRequirement requirement) {
        List<String> command = new ArrayList<>();
        command.add("docker");
        command.add("run");
        command.add("--rm");
        command.add("--name=retrain-" + job.getJobId());
        command.add("--cpus=" + requirement.cpuCores());
        command.add("--memory=" + requirement.memoryMb() + "m");
        command.add(settings.getContainerImage());
        command.addAll(job.getContainerCommand());
        return command;
    }

    /** Keeps only the last lines of container output, up to a character budget. */
    static final class OutputTail {
        private final int maxChars;
        private final Deque<String> lines = new ArrayDeque<>();
        private int chars;

        OutputTail(int maxChars) {
            this.maxChars = maxChars;
        }

        void append(String line) {
            String kept = line.length() > maxChars ? line.substring(line.length() - maxChars) : line;
            lines.addLast(kept);
            chars += kept.length() + 1;
            while (chars > maxChars && lines.size() > 1) {
                chars -= lines.removeFirst().length() + 1;
            }
        }

        @Override
        public String toString() {
            return String.join("\n", lines);
        }
    }
}
