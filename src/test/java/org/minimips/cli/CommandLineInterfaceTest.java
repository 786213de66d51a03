package org.minimips.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.minimips.config.LoggingConfigurator;
import org.minimips.junit.extensions.logging.AllowLog;
import org.minimips.junit.extensions.logging.LogLevel;
import org.minimips.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = rootLogger().getLevel();
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    @AfterEach
    void tearDown() {
        rootLogger().setLevel(originalRootLevel);
        LoggingConfigurator.reset();
    }

    private static Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private String program(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/programs/" + name)) {
            Path file = tempDir.resolve(name);
            Files.write(file, in.readAllBytes());
            return file.toString();
        }
    }

    private String source(String name, String text) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file.toString();
    }

    @Test
    void testCliInitialization() {
        assertThat(cmd.getCommandName()).isEqualTo("minimips");
        assertThat(cmd.getSubcommands()).containsKeys("run", "check", "help");
    }

    @Test
    void runPrintsProgramOutput() throws IOException {
        int exitCode = cmd.execute("run", "-f", program("hello.s"));

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("Hello, MIPS!\n");
    }

    @Test
    void runAppliesInitialRegisters() throws IOException {
        int exitCode = cmd.execute("run", "-f", program("sum.s"), "--reg", "$a1=4");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("10");
    }

    @Test
    void runAppliesInitialMemory() throws IOException {
        String file = source("mem.s", "lw $a0, 0x40\nli $v0, 1\nsyscall\n");

        int exitCode = cmd.execute("run", "-f", file, "--mem", "0x40=-3");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("-3");
    }

    @Test
    void runtimeErrorExitsWithOne() throws IOException {
        String file = source("bad.s", "li $v0, 1\nli $a0, 5\nsyscall\nfoo $t0,$t1\n");

        int exitCode = cmd.execute("run", "-f", file);

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(out.toString()).isEqualTo("5");
        assertThat(err.toString()).contains("error: Unsupported instruction: foo $t0,$t1");
    }

    @Test
    void maxStepsOptionOverridesConfiguration() throws IOException {
        String file = source("loop.s", "loop:\nj loop\n");

        int exitCode = cmd.execute("run", "-f", file, "--max-steps", "50");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(err.toString()).contains("Execution timed out after 50 steps.");
    }

    @Test
    void loadFailureExitsWithTwo() throws IOException {
        String file = source("empty.s", "# nothing here\n");

        int exitCode = cmd.execute("run", "-f", file);

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_LOAD_ERROR);
        assertThat(err.toString()).contains("No instructions found in .text section.");
    }

    @Test
    void missingFileExitsWithTwo() {
        int exitCode = cmd.execute("run", "-f", tempDir.resolve("absent.s").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_LOAD_ERROR);
        assertThat(err.toString()).contains("Cannot read");
    }

    @Test
    void invalidRegisterOptionIsAUsageError() throws IOException {
        int exitCode = cmd.execute("run", "-f", program("sum.s"), "--reg", "$q9=1");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown register: $q9");
    }

    @Test
    void jsonPrintsFinalState() throws IOException {
        int exitCode = cmd.execute("run", "-f", program("sum.s"), "--reg", "$a1=3", "--json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("status").getAsString()).isEqualTo("halted");
        assertThat(json.get("output").getAsString()).isEqualTo("6");
        assertThat(json.getAsJsonObject("registers").get("$t1").getAsInt()).isEqualTo(6);
        assertThat(json.getAsJsonArray("touchedRegisters").toString()).contains("$t0", "$t1", "$a0", "$v0");
    }

    @Test
    void traceWritesOneLinePerStep() throws IOException {
        String file = source("two.s", "li $t0, 1\nli $t1, 2\n");

        int exitCode = cmd.execute("run", "-f", file, "--trace");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(err.toString().lines()).hasSize(3);
        assertThat(err.toString()).contains("li $t0, 1", "$t0=1", "$t1=2", "HALTED");
    }

    @Test
    void checkPrintsListing() throws IOException {
        int exitCode = cmd.execute("check", "-f", program("hello.s"));

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("0000  main:", "la $a0, msg", "data  0x10010000  msg");
    }

    @Test
    void checkWithEagerRejectsInvalidInstructions() throws IOException {
        String file = source("dead.s", "j end\nnonsense here\nend: syscall\n");

        assertThat(cmd.execute("check", "-f", file)).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(cmd.execute("check", "-f", file, "--eager")).isEqualTo(CommandLineInterface.EXIT_LOAD_ERROR);
        assertThat(err.toString()).contains("dead.s:2: Unsupported instruction: nonsense here");
    }

    @Test
    void configFileIsApplied() throws IOException {
        String config = source("custom.conf", "minimips.runtime.max-steps = 7\n");
        String file = source("loop.s", "loop:\nj loop\n");

        int exitCode = cmd.execute("-c", config, "run", "-f", file);

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(err.toString()).contains("Execution timed out after 7 steps.");
    }

    @Test
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*CommandLineInterface", messagePattern = "Failed to load or parse configuration.*")
    void invalidConfigurationIsAUsageError() throws IOException {
        String config = source("broken.conf", "minimips.runtime.max-steps = 0\n");

        int exitCode = cmd.execute("-c", config, "run", "-f", program("hello.s"));

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_LOAD_ERROR);
        assertThat(err.toString()).contains("Invalid configuration");
    }
}
