package info.isaksson.erland.reacttoangular;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    /** Files under the repository's {@code samples} folder; surefire passes its location. */
    private static Path sample(String fileName) {
        return Path.of(System.getProperty("r2a.samples", "../samples"), fileName).toAbsolutePath().normalize();
    }

    @Test
    void convertsSampleWithDefaults() throws Exception {
        Path out = Files.createTempDirectory("r2a-cli-").resolve("out");

        int code = Main.run(new String[] {sample("TodoBox.jsx").toString(), out.toString()});

        assertEquals(Main.EXIT_OK, code);
        assertTrue(Files.exists(out.resolve("TodoBox.component.ts")));
        assertTrue(Files.exists(out.resolve("TodoBox.component.html")));
        assertTrue(Files.exists(out.resolve("TodoBox.component.css")));
        assertFalse(Files.exists(out.resolve("TodoBox.component.spec.ts")));
    }

    @Test
    void warningsDoNotChangeExitCode() throws Exception {
        Path out = Files.createTempDirectory("r2a-cli-hook-");
        assertEquals(Main.EXIT_OK, Main.run(new String[] {sample("Greeting.jsx").toString(), out.toString()}));
        assertTrue(Files.readString(out.resolve("Greeting.component.ts")).contains("BEGIN PASSTHROUGH"));
    }

    @Test
    void flagsOverrideOptionsFile() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-cli-config-");
        Path config = tmp.resolve("options.json");
        Files.writeString(config, "{\"indentWidth\": 8, \"emitSpec\": true}");
        Path out = tmp.resolve("out");
        Path ir = tmp.resolve("timer.ir.json");

        int code = Main.run(new String[] {
                sample("Timer.jsx").toString(), out.toString(),
                "--config", config.toString(),
                "--indent", "4",
                "--write-ir", ir.toString(),
                "--name", "Clock"
        });

        assertEquals(Main.EXIT_OK, code);
        assertTrue(Files.exists(out.resolve("Clock.component.spec.ts")), "emitSpec comes from the options file");
        String ts = Files.readString(out.resolve("Clock.component.ts"));
        assertTrue(ts.contains("\n    selector: 'app-clock',\n"), ts);
        assertTrue(Files.readString(ir).contains("\"Clock\""));
    }

    @Test
    void helpIsNotAnError() {
        assertEquals(Main.EXIT_OK, Main.run(new String[] {"--help"}));
        assertEquals(Main.EXIT_OK, Main.run(new String[] {"-h"}));
    }

    @Test
    void usageErrors() throws Exception {
        String sample = sample("Counter.jsx").toString();
        String out = Files.createTempDirectory("r2a-cli-usage-").toString();

        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {sample}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {sample, out, "extra"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {sample, out, "--bogus"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {sample, out, "--indent"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {sample, out, "--indent", "two"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {sample, out, "--indent", "9"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {sample, out, "--spec", "maybe"}));
    }

    @Test
    void unknownOptionsFileKeyIsAUsageError() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-cli-badconfig-");
        Path config = tmp.resolve("options.json");
        Files.writeString(config, "{\"tabs\": true}");

        int code = Main.run(new String[] {
                sample("Counter.jsx").toString(), tmp.resolve("out").toString(), "--config", config.toString()
        });
        assertEquals(Main.EXIT_USAGE, code);
        assertFalse(Files.exists(tmp.resolve("out")));
    }

    @Test
    void parseErrorExitCode() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-cli-parse-");
        Path input = tmp.resolve("Broken.jsx");
        Files.writeString(input, "function Broken() {\n  return <div>;\n}\n");

        assertEquals(Main.EXIT_PARSE, Main.run(new String[] {input.toString(), tmp.resolve("out").toString()}));
        assertFalse(Files.exists(tmp.resolve("out")));
    }

    @Test
    void ioErrorExitCodes() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-cli-io-");
        assertEquals(Main.EXIT_IO, Main.run(new String[] {tmp.resolve("Missing.jsx").toString(), tmp.resolve("out").toString()}));

        Path blocker = tmp.resolve("blocked");
        Files.writeString(blocker, "file, not a directory");
        assertEquals(Main.EXIT_IO, Main.run(new String[] {sample("Counter.jsx").toString(), blocker.toString()}));

        assertEquals(Main.EXIT_IO, Main.run(new String[] {
                sample("Counter.jsx").toString(), tmp.resolve("out").toString(),
                "--config", tmp.resolve("nope.json").toString()
        }));
    }
}
