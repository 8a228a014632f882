package dev.ccast.treesitter;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCpp;

/** Which tree-sitter grammar parses a file. */
public enum CDialect {
    C {
        @Override
        TSLanguage createLanguage() {
            return new TreeSitterC();
        }
    },
    CPP {
        @Override
        TSLanguage createLanguage() {
            return new TreeSitterCpp();
        }
    };

    private static final Logger logger = LogManager.getLogger(CDialect.class);

    private static final Set<String> CPP_EXTENSIONS =
            Set.of("cc", "cpp", "cxx", "c++", "hpp", "hh", "hxx", "ipp", "tpp");

    abstract TSLanguage createLanguage();

    /**
     * Picks the grammar for {@code path}: an explicit {@code -x} language argument wins, then a {@code -std=} argument,
     * then the file extension. Headers ({@code .h}) and unknown extensions get {@code fallback}.
     */
    public static CDialect resolve(Path path, List<String> arguments, CDialect fallback) {
        var fromArguments = fromLanguageArgument(arguments).or(() -> fromStandardArgument(arguments));
        if (fromArguments.isPresent()) {
            logger.trace("Dialect {} for {} selected by arguments {}", fromArguments.get(), path, arguments);
            return fromArguments.get();
        }
        var dialect = fromExtension(path).orElse(fallback);
        logger.trace("Dialect {} for {} selected by file name", dialect, path);
        return dialect;
    }

    public static CDialect parse(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "c" -> C;
            case "cpp", "c++", "cxx" -> CPP;
            default -> throw new IllegalArgumentException("Unknown dialect '" + name + "', expected c or cpp");
        };
    }

    private static Optional<CDialect> fromLanguageArgument(List<String> arguments) {
        Optional<CDialect> selected = Optional.empty();
        for (int i = 0; i < arguments.size(); i++) {
            var arg = arguments.get(i);
            String language = null;
            if (arg.equals("-x") && i + 1 < arguments.size()) {
                language = arguments.get(++i);
            } else if (arg.startsWith("-x") && arg.length() > 2) {
                language = arg.substring(2);
            }
            if (language != null) {
                // last -x wins, as with compiler drivers
                selected = switch (language) {
                    case "c", "c-header" -> Optional.of(C);
                    case "c++", "c++-header" -> Optional.of(CPP);
                    default -> selected;
                };
            }
        }
        return selected;
    }

    private static Optional<CDialect> fromStandardArgument(List<String> arguments) {
        Optional<CDialect> selected = Optional.empty();
        for (var arg : arguments) {
            if (!arg.startsWith("-std=")) {
                continue;
            }
            var standard = arg.substring("-std=".length()).toLowerCase(Locale.ROOT);
            if (standard.startsWith("c++") || standard.startsWith("gnu++")) {
                selected = Optional.of(CPP);
            } else if (standard.startsWith("c") || standard.startsWith("gnu") || standard.startsWith("iso9899")) {
                selected = Optional.of(C);
            }
        }
        return selected;
    }

    private static Optional<CDialect> fromExtension(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        var name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        var extension = name.substring(dot + 1);
        if (extension.equals("c")) {
            return Optional.of(C);
        }
        // .C is C++ by gcc convention
        if (extension.equals("C") || CPP_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            return Optional.of(CPP);
        }
        return Optional.empty();
    }
}
