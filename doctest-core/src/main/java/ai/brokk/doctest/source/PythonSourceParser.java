package ai.brokk.doctest.source;

import static ai.brokk.doctest.source.AstTraversal.field;
import static ai.brokk.doctest.source.AstTraversal.namedChildren;
import static ai.brokk.doctest.source.AstTraversal.row;
import static ai.brokk.doctest.source.AstTraversal.statements;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

/**
 * Builds the {@link ModuleEntity} tree of a Python source file: module docstring, the {@code __test__} override,
 * top-level classes and functions, and recursively the methods, properties and nested classes of each class.
 *
 * <p>Only what is visible statically is modelled. Definitions nested in functions or in compound statements
 * ({@code if}, {@code try}, ...) are not members, matching what a docstring finder sees through the module and class
 * namespaces.
 */
public final class PythonSourceParser {
    private static final Logger logger = LogManager.getLogger(PythonSourceParser.class);

    private static final String CLASS_DEFINITION = "class_definition";
    private static final String FUNCTION_DEFINITION = "function_definition";
    private static final String DECORATED_DEFINITION = "decorated_definition";
    private static final String DECORATOR = "decorator";
    private static final String EXPRESSION_STATEMENT = "expression_statement";
    private static final String ASSIGNMENT = "assignment";
    private static final String STRING = "string";
    private static final String CONCATENATED_STRING = "concatenated_string";

    private static final String TEST_OVERRIDE_NAME = "__test__";

    private static final Set<String> PROPERTY_DECORATORS =
            Set.of("property", "builtins.property", "abstractproperty", "abc.abstractproperty");

    private final TSLanguage language = new TreeSitterPython();

    /** Reads and parses {@code file} as module {@code moduleName}. */
    public ModuleEntity parseFile(String moduleName, Path file) throws IOException {
        var text = Files.readString(file, StandardCharsets.UTF_8);
        return parse(moduleName, file, text);
    }

    public ModuleEntity parse(String moduleName, @Nullable Path location, String text) {
        var content = SourceContent.of(SourceContent.normalizeLineEndings(text));
        // TSParser is not thread-safe; a parser per call keeps parse() reentrant
        var parser = new TSParser();
        parser.setLanguage(language);
        var tree = parser.parseString(null, content.text());
        var root = tree.getRootNode();

        var body = statements(root);
        var module = new ModuleEntity(moduleName, location, docstringOf(body, content), overrideOf(body, content));
        for (var statement : body) {
            var member = moduleMember(statement, module, content);
            member.ifPresent(module::addMember);
        }
        logger.trace("Parsed module {} with {} top-level members", moduleName, module.members().size());
        return module;
    }

    private Optional<ModuleMember> moduleMember(TSNode statement, ModuleEntity module, SourceContent content) {
        var definition = unwrapDecorated(statement);
        if (definition == null) {
            return Optional.empty();
        }
        if (CLASS_DEFINITION.equals(definition.getType())) {
            return Optional.of(classEntity(definition, module, null, content));
        }
        return nameOf(definition, content)
                .map(name -> new FunctionEntity(
                        name,
                        module,
                        null,
                        FunctionEntity.Kind.FUNCTION,
                        docstringOf(definition, content),
                        row(definition)));
    }

    private ClassEntity classEntity(
            TSNode definition, ModuleEntity module, @Nullable ClassEntity enclosing, SourceContent content) {
        var name = nameOf(definition, content).orElse("<anonymous>");
        var cls = new ClassEntity(name, module, enclosing, docstringOf(definition, content), row(definition));

        var body = field(definition, "body");
        if (body == null) {
            return cls;
        }
        for (var statement : statements(body)) {
            var member = unwrapDecorated(statement);
            if (member == null) {
                continue;
            }
            if (CLASS_DEFINITION.equals(member.getType())) {
                cls.addMember(classEntity(member, module, cls, content));
            } else if (FUNCTION_DEFINITION.equals(member.getType())) {
                classMember(statement, member, module, cls, content).ifPresent(cls::addMember);
            }
        }
        return cls;
    }

    private Optional<SourceEntity> classMember(
            TSNode statement, TSNode function, ModuleEntity module, ClassEntity owner, SourceContent content) {
        var nameOpt = nameOf(function, content);
        if (nameOpt.isEmpty()) {
            return Optional.empty();
        }
        var name = nameOpt.get();
        var decorators = decoratorsOf(statement, content);

        // @x.setter / @x.deleter rebuild the property around the same getter, so the getter's entity stands
        if (decorators.stream().anyMatch(d -> d.endsWith(".setter") || d.endsWith(".deleter"))) {
            return Optional.empty();
        }
        if (decorators.stream().anyMatch(PROPERTY_DECORATORS::contains)) {
            return Optional.of(new PropertyEntity(name, docstringOf(function, content), row(function)));
        }

        FunctionEntity.Kind kind;
        if (decorators.contains("staticmethod")) {
            kind = FunctionEntity.Kind.STATIC_METHOD;
        } else if (decorators.contains("classmethod")) {
            kind = FunctionEntity.Kind.CLASS_METHOD;
        } else {
            kind = FunctionEntity.Kind.METHOD;
        }
        return Optional.of(
                new FunctionEntity(name, module, owner, kind, docstringOf(function, content), row(function)));
    }

    private static @Nullable TSNode unwrapDecorated(TSNode statement) {
        return switch (statement.getType()) {
            case CLASS_DEFINITION, FUNCTION_DEFINITION -> statement;
            case DECORATED_DEFINITION -> field(statement, "definition");
            default -> null;
        };
    }

    private static List<String> decoratorsOf(TSNode statement, SourceContent content) {
        if (!DECORATED_DEFINITION.equals(statement.getType())) {
            return List.of();
        }
        return namedChildren(statement).stream()
                .filter(n -> DECORATOR.equals(n.getType()))
                .flatMap(d -> namedChildren(d).stream().findFirst().stream())
                .map(expr -> content.substringFrom(expr).strip())
                .collect(Collectors.toList());
    }

    private static Optional<String> nameOf(TSNode definition, SourceContent content) {
        var nameNode = field(definition, "name");
        return nameNode == null ? Optional.empty() : Optional.of(content.substringFrom(nameNode));
    }

    private static @Nullable String docstringOf(TSNode definition, SourceContent content) {
        var body = field(definition, "body");
        return body == null ? null : docstringOf(statements(body), content);
    }

    /** The docstring is the value of a string literal that is the first statement of a body. */
    private static @Nullable String docstringOf(List<TSNode> body, SourceContent content) {
        if (body.isEmpty() || !EXPRESSION_STATEMENT.equals(body.get(0).getType())) {
            return null;
        }
        var expressions = namedChildren(body.get(0));
        if (expressions.size() != 1) {
            return null;
        }
        var literal = expressions.get(0);
        if (STRING.equals(literal.getType())) {
            return DocstringLiterals.decode(content.substringFrom(literal)).orElse(null);
        }
        if (CONCATENATED_STRING.equals(literal.getType())) {
            var sb = new StringBuilder();
            for (var part : namedChildren(literal)) {
                if (!STRING.equals(part.getType())) {
                    continue;
                }
                var decoded = DocstringLiterals.decode(content.substringFrom(part));
                if (decoded.isEmpty()) {
                    return null;
                }
                sb.append(decoded.get());
            }
            return sb.toString();
        }
        return null;
    }

    private static DiscoveryOverride overrideOf(List<TSNode> body, SourceContent content) {
        var override = DiscoveryOverride.UNSET;
        for (var statement : body) {
            if (!EXPRESSION_STATEMENT.equals(statement.getType())) {
                continue;
            }
            for (var expr : namedChildren(statement)) {
                if (!ASSIGNMENT.equals(expr.getType())) {
                    continue;
                }
                var left = field(expr, "left");
                var right = field(expr, "right");
                if (left == null || right == null || !TEST_OVERRIDE_NAME.equals(content.substringFrom(left))) {
                    continue;
                }
                // the last assignment wins, as it would at import time
                override = switch (content.substringFrom(right).strip()) {
                    case "True" -> DiscoveryOverride.ENABLED;
                    case "False" -> DiscoveryOverride.DISABLED;
                    default -> DiscoveryOverride.UNSET;
                };
            }
        }
        return override;
    }
}
