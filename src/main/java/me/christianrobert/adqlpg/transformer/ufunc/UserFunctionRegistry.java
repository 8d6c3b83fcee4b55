package me.christianrobert.adqlpg.transformer.ufunc;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.adqlpg.transformer.context.UfuncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known user defined functions, keyed by upper-cased name.
 * <p>
 * The registry comes with the IVOA standard functions and {@code gavo_match};
 * deployments register their own with {@link #register(UserFunction)}.
 * </p>
 */
@ApplicationScoped
public class UserFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(UserFunctionRegistry.class);

    private static final String[] NUMBER_WORDS = {"no", "one", "two", "three", "four", "five"};

    private final Map<String, UserFunction> functions = new ConcurrentHashMap<>();

    public UserFunctionRegistry() {
        registerBuiltins();
    }

    private void registerBuiltins() {
        register(new UserFunction("gavo_match", "gavo_match(pattern TEXT, string TEXT) -> INTEGER",
                "Returns 1 if the POSIX regular expression pattern matches anything in string, 0 otherwise.",
                "INTEGER", "", "", 2,
                args -> "(CASE WHEN " + args.get(1) + " ~ " + args.get(0) + " THEN 1 ELSE 0 END)"));
        register(new UserFunction("ivo_hasword", "ivo_hasword(haystack TEXT, needle TEXT) -> INTEGER",
                "Returns 1 if needle shows up in haystack as a word, 0 otherwise.",
                "INTEGER", "", "", 2,
                args -> "(CASE WHEN to_tsvector(" + args.get(0) + ") @@ plainto_tsquery(" + args.get(1)
                        + ") THEN 1 ELSE 0 END)"));
        register(new UserFunction("ivo_nocasecmp", "ivo_nocasecmp(str1 TEXT, str2 TEXT) -> INTEGER",
                "Returns 1 if str1 and str2 are equal ignoring case, 0 otherwise.",
                "INTEGER", "", "", 2,
                args -> "(CASE WHEN UPPER(" + args.get(0) + ")=UPPER(" + args.get(1) + ") THEN 1 ELSE 0 END)"));
        register(new UserFunction("ivo_hashlist_has", "ivo_hashlist_has(hashlist TEXT, item TEXT) -> INTEGER",
                "Returns 1 if item is one of the #-separated values of hashlist, ignoring case, 0 otherwise.",
                "INTEGER", "", "", 2,
                args -> "(CASE WHEN LOWER(" + args.get(1) + ") = ANY(string_to_array(LOWER("
                        + args.get(0) + "), '#')) THEN 1 ELSE 0 END)"));
    }

    public void register(UserFunction function) {
        UserFunction previous = functions.put(function.getName(), function);
        if (previous != null) {
            log.debug("User function {} replaced", function.getName());
        }
    }

    public boolean isKnown(String name) {
        return functions.containsKey(name.toUpperCase(Locale.ROOT));
    }

    /**
     * @throws UfuncException if there is no function with this name
     */
    public UserFunction lookup(String name) {
        UserFunction function = functions.get(name.toUpperCase(Locale.ROOT));
        if (function == null) {
            throw new UfuncException("No such function: " + name);
        }
        return function;
    }

    /**
     * Looks up a function and checks the number of arguments of a call.
     *
     * @throws UfuncException for unknown functions and wrong argument counts
     */
    public UserFunction checkCall(String name, int argumentCount) {
        UserFunction function = lookup(name);
        if (function.getArity() != argumentCount) {
            int arity = function.getArity();
            String count = arity < NUMBER_WORDS.length ? NUMBER_WORDS[arity] : String.valueOf(arity);
            throw new UfuncException(function.getName() + " takes exactly " + count
                    + (arity == 1 ? " argument" : " arguments"));
        }
        return function;
    }

    public List<UserFunction> getAll() {
        List<UserFunction> result = new ArrayList<>(functions.values());
        result.sort((a, b) -> a.getName().compareTo(b.getName()));
        return result;
    }
}
