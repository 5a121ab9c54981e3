package net.moznion.schedsync;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

public class JobDefinitionTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testReadFullDefinition() throws Exception {
        final JobDefinition job = mapper.readValue(
                "{\"name\":\"daily-report\",\"type\":\"script\",\"schedule\":\"15 8 * * 1-5\","
                + "\"timezone\":\"America/New_York\",\"environment\":\"local\",\"status\":\"paused\","
                + "\"script\":{\"command\":\"node report.cjs\",\"timeout_seconds\":300},"
                + "\"after\":[\"push-granola-tokens\"],\"multi_user\":true,\"owner\":\"pm-team\"}",
                JobDefinition.class);

        assertThat(job.getName()).isEqualTo("daily-report");
        assertThat(job.getKnownType()).contains(JobType.SCRIPT);
        assertThat(job.getSchedule()).isEqualTo("15 8 * * 1-5");
        assertThat(job.getTimezone()).isEqualTo("America/New_York");
        assertThat(job.getEnvironment()).isEqualTo("local");
        assertThat(job.getStatus()).isEqualTo("paused");
        assertThat(job.getScript().getCommand().get()).isEqualTo("node report.cjs");
        assertThat(job.getScript().getTimeoutSeconds().getAsInt()).isEqualTo(300);
        assertThat(job.getAfter()).containsExactly("push-granola-tokens");
        assertThat(job.isPerUser()).isTrue();
        assertThat(job.getAgent()).isNull();
    }

    @Test
    public void testAbsentAndEmptyAfterDiffer() throws Exception {
        final JobDefinition absent = mapper.readValue("{\"name\":\"a\",\"type\":\"script\"}", JobDefinition.class);
        assertThat(absent.getAfter()).isNull();
        assertThat(absent.isPerUser()).isFalse();

        final JobDefinition empty =
                mapper.readValue("{\"name\":\"a\",\"type\":\"script\",\"after\":[]}", JobDefinition.class);
        assertThat(empty.getAfter()).isNotNull().isEmpty();
    }

    @Test
    public void testUnknownTypeIsKept() throws Exception {
        final JobDefinition job = mapper.readValue("{\"name\":\"a\",\"type\":\"webhook\",\"agent\":{\"url\":\"x\"}}",
                                                   JobDefinition.class);
        assertThat(job.getType()).isEqualTo("webhook");
        assertThat(job.getKnownType()).isEmpty();
        assertThat(job.getAgent().get("url").asText()).isEqualTo("x");
    }

    @Test
    public void testScriptCommandStates() throws Exception {
        final ScriptSpec nullCommand = mapper.readValue("{\"command\":null}", ScriptSpec.class);
        assertThat(nullCommand.getCommand().isNull()).isTrue();

        final ScriptSpec missingCommand = mapper.readValue("{\"timeout_seconds\":5}", ScriptSpec.class);
        assertThat(missingCommand.getCommand().isMissing()).isTrue();
        assertThat(missingCommand.getTimeoutSeconds().getAsInt()).isEqualTo(5);

        assertThat(mapper.writeValueAsString(missingCommand.withCommand(OptionalField.of("run"))))
                .isEqualTo("{\"timeout_seconds\":5,\"command\":\"run\"}");
    }
}
