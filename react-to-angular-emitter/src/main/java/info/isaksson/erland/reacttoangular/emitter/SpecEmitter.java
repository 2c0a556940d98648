package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrMethodKind;

/**
 * Jasmine/TestBed scaffold: creates the standalone component and checks that each converted
 * method exists on the instance.
 */
public final class SpecEmitter {

    public String emit(IrComponent component, String name, EmitterOptions options) {
        if (component == null) throw new IllegalArgumentException("component must not be null");
        if (options == null) options = EmitterOptions.defaults();
        String componentName = name == null || name.isBlank() ? component.name : name;
        String className = ComponentNames.className(componentName);
        String module = "./" + ComponentNames.behaviorFile(componentName).replaceAll("\\.ts$", "");

        CodeWriter w = new CodeWriter(options.indentWidth);
        w.line(0, "import { ComponentFixture, TestBed } from '@angular/core/testing';");
        w.line(0, "import { " + className + " } from '" + module + "';");
        w.blank();
        w.line(0, "describe('" + className + "', () => {");
        w.line(1, "let component: " + className + ";");
        w.line(1, "let fixture: ComponentFixture<" + className + ">;");
        w.blank();
        w.line(1, "beforeEach(async () => {");
        w.line(2, "await TestBed.configureTestingModule({");
        w.line(3, "imports: [" + className + "]");
        w.line(2, "}).compileComponents();");
        w.blank();
        w.line(2, "fixture = TestBed.createComponent(" + className + ");");
        w.line(2, "component = fixture.componentInstance;");
        w.line(2, "fixture.detectChanges();");
        w.line(1, "});");
        w.blank();
        w.line(1, "it('should create', () => {");
        w.line(2, "expect(component).toBeTruthy();");
        w.line(1, "});");
        for (IrMethod m : component.methods) {
            if (m.kind == IrMethodKind.GETTER) continue;
            w.blank();
            w.line(1, "it('should define " + m.name + "', () => {");
            w.line(2, "expect(typeof component." + m.name + ").toBe('function');");
            w.line(1, "});");
        }
        w.line(0, "});");
        return w.toString();
    }
}
