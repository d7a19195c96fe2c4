package com.kmg.grobid.cli;

import com.kmg.grobid.model.OptionSet;
import com.kmg.grobid.model.ServiceOperation;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    private static CommandLineOptions parse(String... args) {
        return CommandLineOptions.parse(new DefaultApplicationArguments(args));
    }

    @Test
    void parse_fullCommandLine() {
        CommandLineOptions options = parse("processFulltextDocument", "--input=./pdfs", "--output=./out",
                "--config=./conf.json", "--n=20", "--generateIDs", "--consolidate_citations", "--force",
                "--teiCoordinates", "--report=run.json");

        assertEquals(ServiceOperation.FULL_TEXT, options.operation());
        assertEquals(Path.of("./pdfs"), options.input());
        assertEquals(Path.of("./out"), options.output());
        assertEquals(Path.of("./conf.json"), options.config());
        assertTrue(options.configExplicit());
        assertEquals(20, options.workers());
        assertTrue(options.generateIds());
        assertFalse(options.consolidateHeader());
        assertTrue(options.consolidateCitations());
        assertTrue(options.force());
        assertTrue(options.teiCoordinates());
        assertEquals(Path.of("run.json"), options.report());
        assertEquals(new OptionSet(true, false, true, true, List.of("ref")), options.optionSet(List.of("ref")));
    }

    @Test
    void parse_acceptsValuesSeparatedBySpace() {
        CommandLineOptions options = parse("processFulltextDocument", "--input", "./in", "--output", "./out",
                "--n", "4", "--consolidate_header", "--config", "conf.json", "--report", "run.json");

        assertEquals(ServiceOperation.FULL_TEXT, options.operation());
        assertEquals(Path.of("./in"), options.input());
        assertEquals(Path.of("./out"), options.output());
        assertEquals(4, options.workers());
        assertTrue(options.consolidateHeader());
        assertEquals(Path.of("conf.json"), options.config());
        assertEquals(Path.of("run.json"), options.report());
    }

    @Test
    void parse_serviceMayFollowOptions() {
        CommandLineOptions options = parse("--input", "in", "--force", "processReferences");

        assertEquals(ServiceOperation.REFERENCES, options.operation());
        assertEquals(Path.of("in"), options.input());
        assertTrue(options.force());
    }

    @Test
    void parse_defaults() {
        CommandLineOptions options = parse("processHeaderDocument", "--input=in");

        assertEquals(ServiceOperation.HEADER, options.operation());
        assertNull(options.output());
        assertEquals(Path.of("config.json"), options.config());
        assertFalse(options.configExplicit());
        assertNull(options.workers());
        assertFalse(options.force());
        assertNull(options.report());
    }

    @Test
    void parse_invalidConcurrencyFallsBackToConfiguration() {
        assertNull(parse("processReferences", "--input=in", "--n=lots").workers());
        assertNull(parse("processReferences", "--input=in", "--n=0").workers());
    }

    @Test
    void parse_flagAcceptsExplicitBoolean() {
        assertFalse(parse("processReferences", "--input=in", "--force=false").force());
        assertTrue(parse("processReferences", "--input=in", "--force=true").force());
    }

    @Test
    void parse_rejectsMissingOrUnknownService() {
        assertThrows(IllegalArgumentException.class, () -> parse("--input=in"));
        var ex = assertThrows(IllegalArgumentException.class, () -> parse("processEverything", "--input=in"));
        assertTrue(ex.getMessage().contains("processFulltextDocument"));
    }

    @Test
    void parse_rejectsMissingInput() {
        assertThrows(IllegalArgumentException.class, () -> parse("processReferences"));
    }

    @Test
    void parse_rejectsUnknownOption() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> parse("processReferences", "--input=in", "--consolidate-header"));
        assertTrue(ex.getMessage().contains("--consolidate-header"));
    }
}
