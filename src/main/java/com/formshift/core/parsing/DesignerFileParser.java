package com.formshift.core.parsing;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.DataBinding;
import com.formshift.core.model.PropertyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link FormParser} for WinForms {@code *.Designer.cs} files.
 * <p>
 * Reads the class declaration (the form's name and base type), the control fields, and the
 * statements of {@code InitializeComponent}:
 * <ul>
 *   <li>{@code this.button1.Text = "OK";} property assignments</li>
 *   <li>{@code this.panel1.Controls.Add(this.button1);} and {@code Controls.AddRange(...)} containment</li>
 *   <li>{@code this.button1.Click += new System.EventHandler(this.button1_Click);} event subscriptions</li>
 *   <li>{@code this.textBox1.DataBindings.Add(new Binding("Text", src, "Name"));} data bindings</li>
 * </ul>
 * Anything else is ignored. Text-based: no C# semantic model is built.
 */
@Component
public class DesignerFileParser implements FormParser {

    private static final Logger log = LoggerFactory.getLogger(DesignerFileParser.class);

    /** Matches a class declaration with an optional first base type. */
    private static final Pattern CLASS_PATTERN = Pattern.compile(
            "\\bclass\\s+(\\w+)(?:\\s*:\\s*([\\w.]+))?");

    /** Matches a field declaration: modifier, type, name. */
    private static final Pattern FIELD_PATTERN = Pattern.compile(
            "(?m)^\\s*(?:private|protected|internal|public)\\s+(?:readonly\\s+)?([\\w.]+)\\s+(\\w+)\\s*;");

    private static final Pattern INITIALIZE_PATTERN = Pattern.compile(
            "\\bvoid\\s+InitializeComponent\\s*\\(\\s*\\)\\s*\\{");

    private static final Pattern ADD_PATTERN = Pattern.compile(
            "^(?:this\\.)?(?:(\\w+)\\.)?Controls\\.Add\\(\\s*(?:this\\.)?(\\w+)\\s*\\)$");

    private static final Pattern ADD_RANGE_PATTERN = Pattern.compile(
            "^(?:this\\.)?(?:(\\w+)\\.)?Controls\\.AddRange\\((.*)\\)$", Pattern.DOTALL);

    private static final Pattern BINDING_PATTERN = Pattern.compile(
            "^(?:this\\.)?(\\w+)\\.DataBindings\\.Add\\((.*)\\)$", Pattern.DOTALL);

    private static final Pattern NEW_TYPE_PATTERN = Pattern.compile("^new\\s+([\\w.]+)\\s*\\(");

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("(?:this\\.)?(\\w+)");

    private static final List<String> CONTROL_TYPE_HINTS = List.of(
            "Button", "TextBox", "Label", "Panel", "GroupBox", "DataGridView", "TreeView", "ListView",
            "ComboBox", "CheckBox", "RadioButton", "PictureBox", "ProgressBar", "TabControl", "TabPage",
            "MenuStrip", "ToolStrip", "StatusStrip", "ListBox", "NumericUpDown", "DateTimePicker",
            "SplitContainer", "Control", "Component", "Timer", "ToolTip", "ContextMenu"
    );

    @Override
    public ParseResult parse(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return ParseResult.failure(file, "Cannot read file: " + e.getMessage());
        }
        return parse(file, source);
    }

    /** Parses already-loaded source text; {@code file} is only recorded on the nodes. */
    public ParseResult parse(Path file, String source) {
        String code = SourceText.stripComments(source);

        Matcher classMatcher = CLASS_PATTERN.matcher(code);
        if (!classMatcher.find()) {
            return ParseResult.failure(file, "Class declaration not found");
        }
        Matcher initMatcher = INITIALIZE_PATTERN.matcher(code);
        if (!initMatcher.find()) {
            return ParseResult.failure(file, "InitializeComponent method not found");
        }
        String body = SourceText.blockBody(code, initMatcher.end() - 1);
        if (body == null) {
            return ParseResult.failure(file, "InitializeComponent body is not closed");
        }

        String sourceFile = file.toString();
        String className = classMatcher.group(1);
        String baseType = classMatcher.group(2) != null ? shortName(classMatcher.group(2)) : "Form";
        ControlNode root = new ControlNode(baseType, className, sourceFile, SourceText.lineOf(code, classMatcher.start()));

        Map<String, ControlNode> controls = new LinkedHashMap<>();
        Matcher fieldMatcher = FIELD_PATTERN.matcher(code);
        while (fieldMatcher.find()) {
            String type = fieldMatcher.group(1);
            String name = fieldMatcher.group(2);
            if (isControlType(type) && !name.equals(className)) {
                controls.put(name, new ControlNode(shortName(type), name, sourceFile,
                        SourceText.lineOf(code, fieldMatcher.start(1))));
            }
        }

        List<String> warnings = new ArrayList<>();
        for (String statement : SourceText.statements(body)) {
            try {
                apply(statement, root, controls, sourceFile);
            } catch (IllegalArgumentException e) {
                warnings.add(e.getMessage());
            }
        }

        List<ControlNode> all = new ArrayList<>();
        all.add(root);
        all.addAll(controls.values());
        log.debug("Parsed {} control(s) from {}", all.size(), file.getFileName());
        return ParseResult.success(file, root, all, warnings);
    }

    private void apply(String statement, ControlNode root, Map<String, ControlNode> controls, String sourceFile) {
        Matcher m;
        if ((m = ADD_PATTERN.matcher(statement)).matches()) {
            ControlNode parent = resolve(m.group(1), root, controls);
            ControlNode child = controls.get(m.group(2));
            if (parent != null && child != null) {
                parent.addChild(child);
            }
            return;
        }
        if ((m = ADD_RANGE_PATTERN.matcher(statement)).matches()) {
            ControlNode parent = resolve(m.group(1), root, controls);
            String args = m.group(2);
            int open = args.indexOf('{');
            int close = args.lastIndexOf('}');
            if (parent != null && open >= 0 && close > open) {
                for (String item : args.substring(open + 1, close).split(",")) {
                    ControlNode child = controls.get(stripThis(item.trim()));
                    if (child != null) {
                        parent.addChild(child);
                    }
                }
            }
            return;
        }
        if ((m = BINDING_PATTERN.matcher(statement)).matches()) {
            ControlNode target = controls.get(m.group(1));
            if (target != null) {
                parseBinding(m.group(2)).ifPresent(target::addDataBinding);
            }
            return;
        }

        int addAssign = SourceText.topLevelOperator(statement, "+=");
        if (addAssign > 0) {
            String lhs = stripThis(statement.substring(0, addAssign).trim());
            String rhs = statement.substring(addAssign + 2).trim();
            int dot = lhs.lastIndexOf('.');
            ControlNode target = dot < 0 ? root : resolve(lhs.substring(0, dot), root, controls);
            if (target != null) {
                target.addEvent(lhs.substring(dot + 1), handlerName(rhs));
            }
            return;
        }

        int assign = SourceText.topLevelOperator(statement, "=");
        if (assign > 0) {
            String lhs = statement.substring(0, assign).trim();
            String rhs = statement.substring(assign + 1).trim();
            if (!lhs.startsWith("this.") && lhs.contains(" ")) {
                return;
            }
            String path = stripThis(lhs);
            int dot = path.indexOf('.');
            if (dot < 0) {
                if (controls.containsKey(path) || "components".equals(path)) {
                    return;
                }
                Matcher newType = NEW_TYPE_PATTERN.matcher(rhs);
                if (lhs.startsWith("this.") && newType.find() && isControlType(newType.group(1))) {
                    controls.put(path, new ControlNode(shortName(newType.group(1)), path, sourceFile, null));
                    return;
                }
                root.setProperty(path, PropertyValue.infer(rhs));
                return;
            }
            ControlNode target = controls.get(path.substring(0, dot));
            if (target != null) {
                target.setProperty(path.substring(dot + 1), PropertyValue.infer(rhs));
            }
        }
    }

    private static ControlNode resolve(String name, ControlNode root, Map<String, ControlNode> controls) {
        if (name == null || name.isEmpty() || "this".equals(name) || name.equals(root.name())) {
            return root;
        }
        return controls.get(stripThis(name));
    }

    private static Optional<DataBinding> parseBinding(String args) {
        String inner = args.trim();
        Matcher newType = NEW_TYPE_PATTERN.matcher(inner);
        if (newType.find() && inner.endsWith(")")) {
            inner = inner.substring(newType.end(), inner.length() - 1);
        }
        List<String> parts = SourceText.splitArguments(inner);
        if (parts.size() < 3) {
            return Optional.empty();
        }
        String property = PropertyValue.infer(parts.get(0)).raw();
        String dataSource = stripThis(parts.get(1).trim());
        String member = PropertyValue.infer(parts.get(2)).raw();
        boolean formatting = parts.size() > 3 && "true".equals(parts.get(3).trim());
        String format = parts.size() > 6 ? PropertyValue.infer(parts.get(6)).raw() : null;
        return Optional.of(new DataBinding(property, dataSource, member, format, formatting));
    }

    private static String handlerName(String rhs) {
        String expr = rhs.trim();
        int open = expr.indexOf('(');
        int close = expr.lastIndexOf(')');
        if (expr.startsWith("new ") && open >= 0 && close > open) {
            expr = expr.substring(open + 1, close).trim();
        }
        Matcher id = IDENTIFIER_PATTERN.matcher(stripThis(expr));
        return id.lookingAt() ? id.group(1) : expr;
    }

    private static boolean isControlType(String type) {
        String shortType = shortName(type);
        if ("IContainer".equals(shortType)) {
            return false;
        }
        if (type.startsWith("System.Windows.Forms.")) {
            return true;
        }
        for (String hint : CONTROL_TYPE_HINTS) {
            if (shortType.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static String stripThis(String expr) {
        return expr.startsWith("this.") ? expr.substring(5) : expr;
    }

    static String shortName(String typeName) {
        int dot = typeName.lastIndexOf('.');
        return dot >= 0 ? typeName.substring(dot + 1) : typeName;
    }
}
