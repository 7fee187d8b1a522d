package info.isaksson.erland.mappinglint.expr;

import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import info.isaksson.erland.mappinglint.model.DependencyCategory;
import info.isaksson.erland.mappinglint.model.ExpressionFact;
import info.isaksson.erland.mappinglint.model.SummaryContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recognizes calls on receivers shaped like data access, remote clients, the file system or reflection.
 *
 * <p>No symbol solving: a receiver is judged by the declared type of the captured variable when known,
 * otherwise by its name, and for receivers of unknown type by the called method's verb.</p>
 */
final class DependencyShapes {

    private DependencyShapes() {}

    private static final Map<DependencyCategory, List<String>> RECEIVER_TOKENS = Map.of(
            DependencyCategory.DATA_ACCESS, List.of("repository", "repo", "dao", "entitymanager", "session",
                    "connection", "datasource", "jdbc", "dbcontext", "database", "mongotemplate"),
            DependencyCategory.REMOTE_CALL, List.of("client", "resttemplate", "gateway", "service", "api",
                    "proxy", "stub"),
            DependencyCategory.FILE_IO, List.of("filesystem", "filestore", "storage")
    );

    private static final List<DependencyCategory> CATEGORY_ORDER = List.of(
            DependencyCategory.DATA_ACCESS, DependencyCategory.REMOTE_CALL, DependencyCategory.FILE_IO
    );

    private static final List<String> DATA_VERBS = List.of("query", "execute", "load", "fetch", "find", "select");
    private static final List<String> REMOTE_VERBS = List.of("call", "invoke", "send", "request", "exchange", "post", "download");

    private static final Set<String> REFLECTION_METHODS = Set.of(
            "getMethod", "getDeclaredMethod", "getMethods", "getDeclaredMethods",
            "getField", "getDeclaredField", "getFields", "getDeclaredFields",
            "getConstructor", "getDeclaredConstructor", "newInstance"
    );

    private static final Set<String> FILE_TYPES = Set.of(
            "FileInputStream", "FileOutputStream", "FileReader", "FileWriter", "RandomAccessFile", "Scanner"
    );

    static void collect(ParsedLambda lambda, SummaryContext context, List<ExpressionFact> out) {
        lambda.lambda.getBody().walk(node -> {
            if (node instanceof MethodCallExpr) {
                visitCall((MethodCallExpr) node, lambda, context, out);
            } else if (node instanceof ObjectCreationExpr) {
                ObjectCreationExpr oce = (ObjectCreationExpr) node;
                String type = oce.getType().getNameAsString();
                if (FILE_TYPES.contains(type) && !(type.equals("Scanner") && !isFileArgument(oce))) {
                    out.add(new ExpressionFact.DependencyCall("new " + type, "<init>", DependencyCategory.FILE_IO));
                }
            }
        });
    }

    private static void visitCall(MethodCallExpr mc, ParsedLambda lambda, SummaryContext context, List<ExpressionFact> out) {
        Expression scope = mc.getScope().map(ParsedLambda::unwrap).orElse(null);
        if (scope == null) return;
        String op = mc.getNameAsString();

        if (REFLECTION_METHODS.contains(op) && isClassValued(scope)) {
            out.add(new ExpressionFact.DependencyCall(scope.toString(), op, DependencyCategory.REFLECTION));
            return;
        }

        String receiver;
        if (scope instanceof NameExpr) {
            receiver = ((NameExpr) scope).getNameAsString();
            if (lambda.isDeclaredInside(receiver)) return;
            if (isTypeName(receiver, context)) {
                DependencyCategory staticCategory = staticCategory(receiver, op);
                if (staticCategory != null) {
                    out.add(new ExpressionFact.DependencyCall(receiver, op, staticCategory));
                }
                return;
            }
        } else if (scope instanceof FieldAccessExpr && ((FieldAccessExpr) scope).getScope() instanceof ThisExpr) {
            receiver = ((FieldAccessExpr) scope).getNameAsString();
        } else {
            return;
        }

        String declaredType = context.captures.get(receiver);
        DependencyCategory category = categoryOf(declaredType);
        if (category == null) category = categoryOf(receiver);
        if (category == null && (declaredType == null || declaredType.isBlank())) category = categoryOfVerb(op);
        if (category != null) {
            out.add(new ExpressionFact.DependencyCall(receiver, op, category));
        }
    }

    /** Capitalized names that are not captured variables are read as type names. */
    private static boolean isTypeName(String name, SummaryContext context) {
        return !context.captures.containsKey(name) && Character.isUpperCase(name.charAt(0));
    }

    private static DependencyCategory staticCategory(String type, String op) {
        if (type.equals("Files")) return DependencyCategory.FILE_IO;
        if (type.equals("Class") && op.equals("forName")) return DependencyCategory.REFLECTION;
        if (type.equals("DriverManager")) return DependencyCategory.DATA_ACCESS;
        return null;
    }

    private static boolean isClassValued(Expression scope) {
        if (scope instanceof ClassExpr) return true;
        if (scope instanceof MethodCallExpr) {
            String n = ((MethodCallExpr) scope).getNameAsString();
            return n.equals("getClass") || n.equals("forName");
        }
        return false;
    }

    private static boolean isFileArgument(ObjectCreationExpr oce) {
        for (Expression arg : oce.getArguments()) {
            if (arg instanceof ObjectCreationExpr && ((ObjectCreationExpr) arg).getType().getNameAsString().equals("File")) return true;
            if (arg instanceof MethodCallExpr && ((MethodCallExpr) arg).getNameAsString().equals("of")) return true;
        }
        return false;
    }

    static DependencyCategory categoryOf(String text) {
        if (text == null || text.isBlank()) return null;
        String raw = text;
        int lt = raw.indexOf('<');
        if (lt >= 0) raw = raw.substring(0, lt);
        int dot = raw.lastIndexOf('.');
        String simple = dot >= 0 ? raw.substring(dot + 1) : raw;
        String lower = simple.toLowerCase(Locale.ROOT);
        List<String> words = camelWords(simple);
        for (DependencyCategory c : CATEGORY_ORDER) {
            for (String token : RECEIVER_TOKENS.get(c)) {
                if (lower.endsWith(token) || words.contains(token)) return c;
            }
        }
        return null;
    }

    /** {@code customerRepo} yields {@code [customer, repo]}. */
    private static List<String> camelWords(String s) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                flush(cur, out);
                continue;
            }
            if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(s.charAt(i - 1))) {
                flush(cur, out);
            }
            cur.append(Character.toLowerCase(c));
        }
        flush(cur, out);
        return out;
    }

    private static void flush(StringBuilder cur, List<String> out) {
        if (cur.length() > 0) out.add(cur.toString());
        cur.setLength(0);
    }

    private static DependencyCategory categoryOfVerb(String op) {
        for (String v : DATA_VERBS) {
            if (op.startsWith(v)) return DependencyCategory.DATA_ACCESS;
        }
        for (String v : REMOTE_VERBS) {
            if (op.startsWith(v)) return DependencyCategory.REMOTE_CALL;
        }
        return null;
    }
}
