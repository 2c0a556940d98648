package info.isaksson.erland.reacttoangular.core;

import info.isaksson.erland.reacttoangular.ir.IrJson;
import info.isaksson.erland.reacttoangular.io.WriteError;
import info.isaksson.erland.reacttoangular.parse.ParseError;
import info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TranspileServiceTest {

    /** Files under the repository's {@code samples} folder; surefire passes its location. */
    private static Path sample(String fileName) {
        return Path.of(System.getProperty("r2a.samples", "../samples"), fileName).toAbsolutePath().normalize();
    }

    private final TranspileService service = new TranspileService();

    @Test
    void counterWritesThreeFiles() throws Exception {
        Path out = Files.createTempDirectory("r2a-counter-").resolve("out");
        TranspileResult result = service.transpile(sample("Counter.jsx"), out, new TranspileOptions());

        assertTrue(result.warnings.isEmpty(), "unexpected warnings: " + result.warnings);
        assertEquals(List.of(out.resolve("Counter.component.ts"), out.resolve("Counter.component.html"),
                out.resolve("Counter.component.css")), result.writtenFiles);

        String ts = Files.readString(out.resolve("Counter.component.ts"));
        assertTrue(ts.contains("export class CounterComponent {"), ts);
        assertTrue(ts.contains("  count: number = 0;\n"), ts);
        assertTrue(ts.contains("  onButtonClick() {\n    this.count = this.count + 1;\n  }\n"), ts);
        assertTrue(ts.contains("  onButtonClick2() {\n    this.count = 0;\n  }\n"), ts);

        String html = Files.readString(out.resolve("Counter.component.html"));
        assertTrue(html.contains("<p>Count: {{ count }}</p>"), html);
        assertTrue(html.contains("(click)=\"onButtonClick()\""), html);
        assertTrue(html.contains("(click)=\"onButtonClick2()\""), html);

        assertEquals("/* No styles collected for Counter. */\n", Files.readString(out.resolve("Counter.component.css")));
    }

    @Test
    void intervalEffectMapsToOnInitAndOnDestroy() throws Exception {
        Path out = Files.createTempDirectory("r2a-timer-");
        service.transpile(sample("Timer.jsx"), out, new TranspileOptions());

        String ts = Files.readString(out.resolve("Timer.component.ts"));
        assertTrue(ts.contains("import { Component, OnDestroy, OnInit } from '@angular/core';"), ts);
        assertTrue(ts.contains("  time: number = 0;\n"), ts);
        assertTrue(ts.contains("  id: any;\n"), ts);
        assertTrue(ts.contains("  ngOnInit(): void {\n    this.id = setInterval("), ts);
        assertTrue(ts.contains("  ngOnDestroy(): void {\n    clearInterval(this.id);\n  }\n"), ts);
        assertFalse(ts.contains("ngDoCheck"), ts);
        assertEquals("<h1>{{ time }}</h1>\n", Files.readString(out.resolve("Timer.component.html")));
    }

    @Test
    void twoWayInputListAndImportedStylesheet() throws Exception {
        Path out = Files.createTempDirectory("r2a-todo-");
        TranspileResult result = service.transpile(sample("TodoBox.jsx"), out, new TranspileOptions());

        assertTrue(result.warnings.isEmpty(), "unexpected warnings: " + result.warnings);
        String ts = Files.readString(out.resolve("TodoBox.component.ts"));
        assertTrue(ts.contains("import { FormsModule } from '@angular/forms';"), ts);
        assertTrue(ts.contains("imports: [CommonModule, FormsModule],"), ts);
        assertTrue(ts.contains("this.todos.push(this.text);"), ts);

        String html = Files.readString(out.resolve("TodoBox.component.html"));
        assertTrue(html.contains("<input [(ngModel)]=\"text\">"), html);
        assertTrue(html.contains("<button (click)=\"add()\">Add</button>"), html);
        assertTrue(html.contains("<li *ngFor=\"let t of todos; let i = index\">{{ t }}</li>"), html);
        assertFalse(html.contains("onChange"), html);

        assertEquals(Files.readString(sample("TodoBox.css")),
                Files.readString(out.resolve("TodoBox.component.css")));
    }

    @Test
    void customHookIsPassedThroughWithWarning() throws Exception {
        Path out = Files.createTempDirectory("r2a-greeting-");
        TranspileResult result = service.transpile(sample("Greeting.jsx"), out, new TranspileOptions());

        List<String> codes = result.warnings.stream().map(w -> w.code).collect(Collectors.toList());
        assertTrue(codes.contains(UnsupportedConstructWarning.UNSUPPORTED_HOOK), codes.toString());
        assertTrue(codes.contains(UnsupportedConstructWarning.UNSUPPORTED_STATEMENT), codes.toString());

        String ts = Files.readString(out.resolve("Greeting.component.ts"));
        assertTrue(ts.contains("@Input() name: string = \"friend\";"), ts);
        assertTrue(ts.contains("BEGIN PASSTHROUGH"), ts);
        assertTrue(ts.contains("useWindowWidth()"), ts);

        String html = Files.readString(out.resolve("Greeting.component.html"));
        assertTrue(html.contains("<h2 *ngIf=\"visible\">Hello, {{ name }}!</h2>"), html);
    }

    @Test
    void dashboardConvertsWithWarnings() throws Exception {
        Path out = Files.createTempDirectory("r2a-dashboard-");
        TranspileResult result = service.transpile(sample("Dashboard.jsx"), out, new TranspileOptions());

        assertFalse(result.warnings.isEmpty());
        assertTrue(result.warnings.stream().anyMatch(w -> w.message.contains("useContext")), result.warnings.toString());

        String ts = Files.readString(out.resolve("Dashboard.component.ts"));
        assertTrue(ts.contains("@Input() user: any;"), ts);
        assertTrue(ts.contains("@Input() widgets: any;"), ts);
        assertTrue(ts.contains("async fetchData() {"), ts);
        assertTrue(ts.contains("this.fetchData();"), ts);

        String html = Files.readString(out.resolve("Dashboard.component.html"));
        assertTrue(html.contains("*ngIf=\"loading\""), html);
        assertTrue(html.contains("*ngFor=\"let widget of widgets\""), html);
    }

    @Test
    void specScaffoldAndIrSnapshotWhenRequested() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-extras-");
        TranspileOptions options = new TranspileOptions();
        options.emitSpec = true;
        options.irOutput = tmp.resolve("ir").resolve("counter.ir.json");

        TranspileResult result = service.transpile(sample("Counter.jsx"), tmp.resolve("out"), options);

        assertEquals(5, result.writtenFiles.size());
        assertTrue(Files.exists(tmp.resolve("out").resolve("Counter.component.spec.ts")));
        String ir = Files.readString(options.irOutput);
        assertTrue(ir.contains("\"schemaVersion\""), ir);
        assertTrue(ir.contains("\"setCount\""), ir);
        assertEquals(result.component, IrJson.readFromString(ir));
    }

    @Test
    void outputIsByteForByteStable() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-determinism-");
        for (String sample : List.of("Counter.jsx", "Timer.jsx", "TodoBox.jsx", "Greeting.jsx", "Dashboard.jsx")) {
            TranspileResult a = service.transpile(sample(sample), tmp.resolve("a"), new TranspileOptions());
            TranspileResult b = service.transpile(sample(sample), tmp.resolve("b"), new TranspileOptions());
            assertEquals(a.warnings, b.warnings);
            for (int i = 0; i < a.writtenFiles.size(); i++) {
                assertArrayEquals(Files.readAllBytes(a.writtenFiles.get(i)), Files.readAllBytes(b.writtenFiles.get(i)),
                        "Output differs for " + a.writtenFiles.get(i).getFileName());
            }
        }
    }

    @Test
    void typeScriptComponentIsConverted() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-tsx-");
        Path input = tmp.resolve("Stepper.tsx");
        Files.writeString(input, String.join("\n",
                "import React, { useState } from 'react';",
                "",
                "interface StepperProps {",
                "  start: number;",
                "  label?: string;",
                "}",
                "",
                "export default function Stepper({ start, label = 'Step' }: StepperProps): JSX.Element {",
                "  const [value, setValue] = useState<number>(start);",
                "  return (",
                "    <button onClick={() => setValue(value + 1)}>",
                "      {label} &amp; {value as number}",
                "    </button>",
                "  );",
                "}",
                ""));

        TranspileResult result = service.transpile(input, tmp.resolve("out"), new TranspileOptions());

        assertEquals("Stepper", result.component.name);
        assertEquals(List.of("start", "label"),
                result.component.inputs.stream().map(p -> p.name).collect(Collectors.toList()));
        String ts = Files.readString(tmp.resolve("out").resolve("Stepper.component.ts"));
        assertTrue(ts.contains("  ngOnInit(): void {\n    this.value = this.start;\n  }\n"), ts);
        assertTrue(ts.contains("interface StepperProps {"), ts);
        String html = Files.readString(tmp.resolve("out").resolve("Stepper.component.html"));
        assertTrue(html.contains("(click)=\"onButtonClick()\""), html);
        assertTrue(html.contains("{{ label }} &amp; {{ value }}"), html);
    }

    @Test
    void parseErrorWritesNothing() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-parse-");
        Path input = tmp.resolve("Broken.jsx");
        Files.writeString(input, "function Broken() {\n  return <div>;\n}\n");
        Path out = tmp.resolve("out");

        assertThrows(ParseError.class, () -> service.transpile(input, out, new TranspileOptions()));
        assertFalse(Files.exists(out));
    }

    @Test
    void missingComponentIsAParseError() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-nocomponent-");
        Path input = tmp.resolve("util.js");
        Files.writeString(input, "export const add = (a, b) => a + b;\n");

        ParseError e = assertThrows(ParseError.class, () -> service.transpile(input, tmp.resolve("out"), new TranspileOptions()));
        assertEquals("No React function component found", e.getMessage());
        assertEquals(1, e.getLine());
    }

    @Test
    void missingStylesheetIsAWarning() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-css-");
        Path input = tmp.resolve("Card.jsx");
        Files.writeString(input, "import './Card.css';\nexport default function Card() {\n  return <div className=\"card\">Hi</div>;\n}\n");

        TranspileResult result = service.transpile(input, tmp.resolve("out"), new TranspileOptions());
        assertEquals(1, result.warnings.size());
        assertEquals(UnsupportedConstructWarning.MISSING_STYLESHEET, result.warnings.get(0).code);
        assertEquals("/* No styles collected for Card. */\n", Files.readString(tmp.resolve("out").resolve("Card.component.css")));
    }

    @Test
    void nameOverrideAndAnonymousFallback() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-names-");
        Path input = tmp.resolve("user-badge.jsx");
        Files.writeString(input, "export default () => <span>badge</span>;\n");

        TranspileResult fallback = service.transpile(input, tmp.resolve("a"), new TranspileOptions());
        assertEquals("UserBadge", fallback.component.name);
        assertTrue(Files.exists(tmp.resolve("a").resolve("UserBadge.component.ts")));

        TranspileOptions named = new TranspileOptions();
        named.name = "status-pill";
        TranspileResult renamed = service.transpile(input, tmp.resolve("b"), named);
        assertEquals("StatusPill", renamed.component.name);
        assertEquals("app-status-pill", renamed.component.selector);
        assertTrue(Files.exists(tmp.resolve("b").resolve("StatusPill.component.html")));
    }

    @Test
    void unwritableOutputDirectoryIsAWriteError() throws Exception {
        Path tmp = Files.createTempDirectory("r2a-write-");
        Path blocker = tmp.resolve("out");
        Files.writeString(blocker, "not a directory");

        WriteError e = assertThrows(WriteError.class,
                () -> service.transpile(sample("Counter.jsx"), blocker, new TranspileOptions()));
        assertEquals(blocker, e.getPath());
    }

    @Test
    void fallbackNameFromFileName() {
        assertEquals("TodoBox", TranspileService.fallbackName(Path.of("dir", "todo-box.jsx")));
        assertEquals("Timer", TranspileService.fallbackName(Path.of("Timer.component.jsx")));
    }
}
