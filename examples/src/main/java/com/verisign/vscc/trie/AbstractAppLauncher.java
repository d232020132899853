package com.verisign.vscc.trie;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * <pre>
 * public static void main(String[] args) throws Exception {
 *   int res = new Yourclass extends AbstractAppLauncher().run(args);
 *   System.exit(res);
 * }
 * </pre>
 * Options given on the command line take precedence over the ones
 * read from the <code>--config</code> properties file.
 */
public abstract class AbstractAppLauncher implements Closeable {

    public static final String OPTION_DICTIONARY = "dictionary";
    public static final String OPTION_SEPARATOR = "separator";
    public static final String OPTION_CONFIG = "config";
    public static final String PROPERTY_DICTIONARY = "trie.dictionary";
    public static final String PROPERTY_SEPARATOR = "trie.separator";
    protected static final String OPTION_HELP = "help";

    protected final Logger LOG = LoggerFactory.getLogger(getClass());
    private final OptionParser parser = new OptionParser();
    private final PrintStream out;
    private final PrintStream err;

    private OptionSet options;
    private Properties config = new Properties();
    private CharTrie<String> trie;

    protected AbstractAppLauncher() {
        this(System.out, System.err);
    }

    protected AbstractAppLauncher(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    protected final OptionSet getOptions() {
        return options;
    }

    protected final OptionParser getParser() {
        return parser;
    }

    protected final CharTrie<String> getTrie() {
        return trie;
    }

    protected final PrintStream getOut() {
        return out;
    }

    protected final PrintStream getErr() {
        return err;
    }

    public final int run(String[] args) throws Exception {

        privateInitParser();

        boolean invalidOptions = false;
        try {
            options = getParser().parse(args);
        } catch (OptionException e) {
            invalidOptions = true;
            err.println("Invalid argument: " + e.getMessage());
            err.println("Run with --" + OPTION_HELP + " for help.");
        }

        if (invalidOptions || options.has(OPTION_HELP)) {
            getParser().printHelpOn(out);
            return ReturnCode.HELP;
        }

        String configPath = (String) options.valueOf(OPTION_CONFIG);
        if (configPath != null) {
            try {
                config = TrieLoader.loadProperties(configPath);
            } catch (FileNotFoundException e) {
                err.println("Cannot find the configuration file " + configPath);
                return ReturnCode.GENERIC_WRONG_CONFIG;
            }
        }

        String dictionary = getSetting(OPTION_DICTIONARY, PROPERTY_DICTIONARY, null);
        String separator = getSetting(OPTION_SEPARATOR, PROPERTY_SEPARATOR, TrieLoader.DEFAULT_SEPARATOR);
        if (dictionary == null) {
            err.println("No dictionary given. Please set --" + OPTION_DICTIONARY + " or the "
                    + PROPERTY_DICTIONARY + " property of the --" + OPTION_CONFIG + " file.");
            return ReturnCode.GENERIC_WRONG_CONFIG;
        }
        if (separator.isEmpty()) {
            err.println("The separator can't be empty.");
            return ReturnCode.GENERIC_WRONG_CONFIG;
        }

        try {
            trie = new TrieLoader(separator).load(dictionary);
        } catch (FileNotFoundException e) {
            err.println("Dictionary " + dictionary + " not found. Please check the --" + OPTION_DICTIONARY
                    + " argument.");
            return ReturnCode.DICTIONARY_NOT_FOUND;
        }

        return internalRun();

    }

    private String getSetting(String option, String property, String defaultValue) {
        String value = (String) options.valueOf(option);
        if (value == null) {
            value = config.getProperty(property, defaultValue);
        }
        return value;
    }

    protected abstract int internalRun() throws Exception;

    private void privateInitParser() {
        getParser().accepts(OPTION_DICTIONARY, "Dictionary file, one key and value per line. Looked up on the filesystem, " +
                "then on the classpath.")
                .withRequiredArg();
        getParser().accepts(OPTION_SEPARATOR, "Separator between the key and the value in the dictionary file. " +
                "Default is a tab.")
                .withRequiredArg();
        getParser().accepts(OPTION_CONFIG, "Properties file providing defaults (" + PROPERTY_DICTIONARY + ", "
                + PROPERTY_SEPARATOR + ")")
                .withRequiredArg();

        initParser();

        getParser().accepts(OPTION_HELP, "Print this help").forHelp();
    }

    /**
     * Override this function to add more options to the command line parser.
     */
    protected void initParser() {
    }

    @Override
    public final void close() throws IOException {
        internalClose();
        out.flush();
    }

    /**
     * Override this function to close additional resources.
     *
     * @throws IOException
     */
    protected void internalClose() throws IOException {
    }

    protected static class ReturnCode {

        public static final int ALL_GOOD = 0;
        public static final int HELP = 1;
        public static final int DICTIONARY_NOT_FOUND = 2;
        public static final int GENERIC_WRONG_CONFIG = 3;
    }
}
