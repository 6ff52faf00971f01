package com.kmg.tagger.config;

import com.kmg.tagger.dto.JobRequest;
import com.kmg.tagger.dto.JobView;
import com.kmg.tagger.model.JobStatus;
import com.kmg.tagger.model.Profile;
import com.kmg.tagger.service.TaggingJobService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandLineJobRunnerTest {
    @Mock
    TaggingJobService jobService;

    @Test
    void parsesEveryOption() {
        JobRequest request = CommandLineJobRunner.toRequest(new DefaultApplicationArguments(
                "--input=/shoot", "--profile=racing-imsa", "--fuzzy-numbers", "--output-dir=/out",
                "--resume", "--dry-run", "--max-images=25", "--warm-up", "--detect-sequences",
                "--sequence-threshold=0.8", "--skip-sequence-sharpness", "--model=llava:13b"));

        assertThat(request.inputPath()).isEqualTo("/shoot");
        assertThat(request.profile()).isEqualTo(Profile.RACING_IMSA);
        assertThat(request.fuzzyNumbers()).isTrue();
        assertThat(request.outputDir()).isEqualTo("/out");
        assertThat(request.resume()).isTrue();
        assertThat(request.reset()).isFalse();
        assertThat(request.dryRun()).isTrue();
        assertThat(request.maxImages()).isEqualTo(25);
        assertThat(request.warmUp()).isTrue();
        assertThat(request.detectSequences()).isTrue();
        assertThat(request.sequenceThreshold()).isEqualTo(0.8);
        assertThat(request.sequenceDryRun()).isFalse();
        assertThat(request.skipSequenceSharpness()).isTrue();
        assertThat(request.model()).isEqualTo("llava:13b");
    }

    @Test
    void rejectsBadNumbers() {
        assertThatThrownBy(() -> CommandLineJobRunner.toRequest(
                new DefaultApplicationArguments("--input=/shoot", "--max-images=0")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommandLineJobRunner.toRequest(
                new DefaultApplicationArguments("--input=/shoot", "--sequence-threshold=-1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommandLineJobRunner.toRequest(
                new DefaultApplicationArguments("--input=/shoot", "--profile=rally")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recognisesCommandLineInvocation() {
        assertThat(CommandLineJobRunner.isCommandLineInvocation(new String[]{"--input=/shoot"})).isTrue();
        assertThat(CommandLineJobRunner.isCommandLineInvocation(new String[]{"--server.port=9000"})).isFalse();
    }

    @Test
    void exitCodeFollowsJobOutcome() {
        when(jobService.runJob(any())).thenReturn(view(JobStatus.FAILED));
        CommandLineJobRunner runner = new CommandLineJobRunner(jobService);

        runner.run(new DefaultApplicationArguments("--input=/shoot"));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void completedJobExitsCleanly() {
        when(jobService.runJob(any())).thenReturn(view(JobStatus.COMPLETED));
        CommandLineJobRunner runner = new CommandLineJobRunner(jobService);

        runner.run(new DefaultApplicationArguments("--input=/shoot"));

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void rejectedJobExitsWithError() {
        when(jobService.runJob(any())).thenThrow(new IllegalArgumentException("Input path does not exist: /shoot"));
        CommandLineJobRunner runner = new CommandLineJobRunner(jobService);

        runner.run(new DefaultApplicationArguments("--input=/shoot"));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void serverModeDoesNothing() {
        CommandLineJobRunner runner = new CommandLineJobRunner(jobService);

        runner.run(new DefaultApplicationArguments("--server.port=9000"));

        verifyNoInteractions(jobService);
        assertThat(runner.getExitCode()).isZero();
    }

    private static JobView view(JobStatus status) {
        return new JobView("job-1", "/shoot", status, null, null, null, 0, 0, 0, 0, 0, 0, 0, null);
    }
}
