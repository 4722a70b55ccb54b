package com.evalexpr.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @Test
    void parsesOptions() {
        Main main = new Main();
        new CommandLine(main).parseArgs("-v", "--cache-size", "0", "prog.ee");
        assertThat(main.verbose).isTrue();
        assertThat(main.cacheSize).isZero();
        assertThat(main.file).isEqualTo("prog.ee");
        assertThat(main.expression).isNull();
    }

    @Test
    void defaultCacheSize() {
        Main main = new Main();
        new CommandLine(main).parseArgs("-e", "1 + 1");
        assertThat(main.cacheSize).isEqualTo(256);
        assertThat(main.expression).isEqualTo("1 + 1");
    }

    @Test
    void printsVersion() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        assertThat(cmd.execute("--version")).isZero();
        assertThat(out.toString()).contains("EvalExpr v0.1.0");
    }

    @Test
    void rejectsBadCacheSize() {
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setErr(new PrintWriter(err, true));
        assertThat(cmd.execute("--cache-size", "lots")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--cache-size");
    }

    @Test
    void tapeSubcommandParsesFile() {
        CommandLine cmd = new CommandLine(new Main());
        CommandLine.ParseResult result = cmd.parseArgs("tape", "prog.ee");
        assertThat(result.subcommand()).isNotNull();
        TapeCommand tape = result.subcommand().commandSpec().commandLine().getCommand();
        assertThat(tape.file).isEqualTo("prog.ee");
    }
}
