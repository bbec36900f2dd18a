package com.modelretraining.service;

import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.model.ResourceRequirement;
import com.modelretraining.model.TrainingJob;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ContainerJobRunnerTest {

    @Test
    void buildCommand_capsCpuAndMemoryAndAppendsJobCommand() {
        RetrainingSettings settings = RetrainingSettings.builder().containerImage("trainer:1.4").build();
        ContainerJobRunner runner = new ContainerJobRunner(settings);
        TrainingJob job = TrainingJob.builder()
            .payload(() -> { })
            .containerCommand(List.of("python", "-m", "retrain", "--trigger", "drift-A"))
            .build();

        List<String> command = runner.buildCommand(job, new ResourceRequirement(2, 4096));

        assertThat(command).startsWith("docker", "run", "--rm");
        assertThat(command).contains("--name=retrain-" + job.getJobId(), "--cpus=2", "--memory=4096m");
        assertThat(command).endsWith("trainer:1.4", "python", "-m", "retrain", "--trigger", "drift-A");
    }

    @Test
    void outputTail_keepsOnlyLatestLinesWithinBudget() {
        ContainerJobRunner.OutputTail tail = new ContainerJobRunner.OutputTail(20);
        for (int i = 0; i < 1_000; i++) {
            tail.append("epoch " + i);
        }

        assertThat(tail.toString()).isEqualTo("epoch 998\nepoch 999");
    }

    @Test
    void outputTail_overlongLineKeepsItsEnd() {
        ContainerJobRunner.OutputTail tail = new ContainerJobRunner.OutputTail(10);
        tail.append("Traceback: ValueError");

        assertThat(tail.toString()).isEqualTo("ValueError");
    }
}
