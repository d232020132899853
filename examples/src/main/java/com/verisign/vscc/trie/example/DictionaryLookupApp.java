package com.verisign.vscc.trie.example;

import com.verisign.vscc.trie.AbstractAppLauncher;
import com.verisign.vscc.trie.CharTrie;
import com.verisign.vscc.trie.TrieEntries;
import com.verisign.vscc.trie.TrieEntry;
import com.verisign.vscc.trie.utils.TrieJson;

import java.io.PrintStream;
import java.util.*;

/**
 * Load a dictionary in a trie, then print the entries matching the given prefixes as JSON, one line per prefix.
 * <pre>
 * $ java com.verisign.vscc.trie.example.DictionaryLookupApp --dictionary words.tsv --prefix te --prefix to
 * {"prefix":"te","results":[{"key":"tea","value":"3"},{"key":"ted","value":"4"}]}
 * {"prefix":"to","results":[{"key":"to","value":"7"}]}
 * </pre>
 */
public class DictionaryLookupApp extends AbstractAppLauncher {

    public static final String OPTION_PREFIX = "prefix";
    public static final String OPTION_DELETE = "delete";
    public static final String OPTION_MAX_PREFIX = "max-prefix";

    public static void main(String[] args) throws Exception {
        int res;
        try (DictionaryLookupApp app = new DictionaryLookupApp()) {
            res = app.run(args);
        }
        System.exit(res);
    }

    public DictionaryLookupApp() {
        super();
    }

    public DictionaryLookupApp(PrintStream out, PrintStream err) {
        super(out, err);
    }

    @Override
    protected void initParser() {
        getParser().accepts(OPTION_PREFIX, "Prefix to search for. Can be repeated, no prefix lists the whole dictionary.")
                .withRequiredArg();
        getParser().accepts(OPTION_DELETE, "Key to remove from the dictionary before searching. Can be repeated.")
                .withRequiredArg();
        getParser().accepts(OPTION_MAX_PREFIX, "Print the longest dictionary key which is a prefix of the given string. " +
                "Can't be combined with --" + OPTION_PREFIX + ".")
                .withRequiredArg();
    }

    @Override
    protected int internalRun() throws Exception {

        if (getOptions().has(OPTION_MAX_PREFIX) && getOptions().has(OPTION_PREFIX)) {
            getErr().println("Either specify --" + OPTION_PREFIX + " or --" + OPTION_MAX_PREFIX + ", but not both.");
            return ReturnCode.HELP;
        }

        final CharTrie<String> trie = getTrie();

        for (Object key : getOptions().valuesOf(OPTION_DELETE)) {
            if (!trie.delete(key.toString())) {
                LOG.warn("Key {} not found in the dictionary, nothing deleted", key);
            }
        }

        if (getOptions().has(OPTION_MAX_PREFIX)) {
            final String input = getOptions().valueOf(OPTION_MAX_PREFIX).toString();
            final Map.Entry<String, List<String>> maxPrefix = trie.findMaxPrefix(input);
            final TrieEntries<String> entries = new TrieEntries<>();
            if (maxPrefix != null) {
                for (String value : maxPrefix.getValue()) {
                    entries.add(new TrieEntry<>(value, maxPrefix.getKey()));
                }
            }
            getOut().println(TrieJson.toJson(input, entries));
            return ReturnCode.ALL_GOOD;
        }

        List<?> prefixes = getOptions().valuesOf(OPTION_PREFIX);
        if (prefixes.isEmpty()) {
            prefixes = Collections.singletonList("");
        }
        for (Object prefix : prefixes) {
            final TrieEntries<String> entries = trie.search(prefix.toString());
            LOG.debug("{} entries found for prefix '{}'", entries.size(), prefix);
            getOut().println(TrieJson.toJson(prefix.toString(), entries));
        }

        return ReturnCode.ALL_GOOD;
    }
}
