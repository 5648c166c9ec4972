package io.attrspans.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for command-line parsing.
 */
class CliOptionsTest {

    @Test
    void parses_command_script_and_options_in_any_order() {
        var opts = CliOptions.fromArgs(new String[]{"-v", "collapse", "--content-length", "12", "edits.json"});

        assertEquals("collapse", opts.command());
        assertEquals(Path.of("edits.json"), opts.scriptPath());
        assertEquals(12, opts.contentLength());
        assertTrue(opts.verbose());
        assertFalse(opts.help());
    }

    @Test
    void content_length_defaults_to_null() {
        var opts = CliOptions.fromArgs(new String[]{"markers", "edits.json"});

        assertNull(opts.contentLength());
        assertFalse(opts.verbose());
    }

    @Test
    void help_short_circuits_everything_else() {
        var opts = CliOptions.fromArgs(new String[]{"bogus", "-h", "--nope"});

        assertTrue(opts.help());
    }

    @Test
    void rejects_bad_input() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{"render", "a.json"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{"markers"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{"markers", "a.json", "b.json"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{"--frobnicate", "markers", "a.json"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{"collapse", "a.json", "-l"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{"collapse", "a.json", "-l", "ten"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.fromArgs(new String[]{"collapse", "a.json", "-l", "-3"}));
    }
}
