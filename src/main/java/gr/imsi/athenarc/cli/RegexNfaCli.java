package gr.imsi.athenarc.cli;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.cli.util.TestSuiteCsvWriter;
import gr.imsi.athenarc.regexnfa.config.NFAConfiguration;
import gr.imsi.athenarc.regexnfa.manager.CompiledRegex;
import gr.imsi.athenarc.regexnfa.manager.NFAManager;
import gr.imsi.athenarc.regexnfa.manager.RegexSession;
import gr.imsi.athenarc.regexnfa.manager.TestCaseResult;
import gr.imsi.athenarc.regexnfa.manager.TestSuiteResult;
import gr.imsi.athenarc.regexnfa.nfa.NFAConstructionException;
import gr.imsi.athenarc.regexnfa.persistence.NFAStore;
import gr.imsi.athenarc.regexnfa.persistence.SavedNFA;
import gr.imsi.athenarc.regexnfa.regex.InvalidRegexException;

/**
 * Command line front-end: converts a regex to an NFA, prints it, simulates
 * strings against it and saves or loads it.
 */
public class RegexNfaCli {

    private static final Logger LOG = LoggerFactory.getLogger(RegexNfaCli.class);

    @Parameter(names = "-regex", description = "Regular expression to convert")
    public String regex;

    @Parameter(names = "-test", variableArity = true, description = "Strings to simulate against the NFA")
    public List<String> tests;

    @Parameter(names = "-testFile", description = "File with one test string per line")
    public String testFile;

    @Parameter(names = "-out", description = "CSV file for the test suite results")
    public String out;

    @Parameter(names = "-save", description = "Save the built NFA")
    public boolean save;

    @Parameter(names = "-load", description = "Load a saved NFA instead of building one")
    public boolean load;

    @Parameter(names = "-file", description = "Saved NFA file (default from nfa.store.file)")
    public String file;

    @Parameter(names = "-config", description = "Path to a properties file overriding application.properties")
    public String configFile;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    private final PrintStream console;

    public RegexNfaCli() {
        this(System.out);
    }

    RegexNfaCli(PrintStream console) {
        this.console = console;
    }

    public static void main(String... args) {
        RegexNfaCli cli = new RegexNfaCli();
        JCommander jCommander = new JCommander(cli);
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            LOG.error(e.getMessage());
            jCommander.usage();
            System.exit(2);
        }
        if (cli.help) {
            jCommander.usage();
            return;
        }
        int status = cli.run();
        if (status != 0) {
            System.exit(status);
        }
    }

    int run() {
        Preconditions.checkArgument(regex != null || load, "Specify -regex to build an NFA or -load to read one.");

        Properties properties = configFile != null ? readPropertiesFromFile(configFile) : readProperties();
        NFAConfiguration configuration = NFAConfiguration.fromProperties(properties);
        LOG.debug("Using {}", configuration);

        RegexSession session = new RegexSession(NFAManager.fromConfiguration(configuration), new NFAStore());
        Path nfaFile = Paths.get(file != null ? file : configuration.getStoreFile());

        try {
            if (load) {
                SavedNFA saved = session.load(nfaFile);
                console.println("Postfix: " + saved.getPostfix());
                console.println();
                console.println("Transitions:");
                console.println(saved.getTransitions());
            }
            if (regex != null) {
                CompiledRegex compiled = session.convert(regex);
                console.println("Postfix: " + compiled.getPostfix());
                console.println();
                console.println("Transitions:");
                console.println(session.describe().render());
            }
            if ((tests != null || testFile != null) && !session.hasAutomaton()) {
                LOG.error("No NFA available. Process a regex first.");
                return 1;
            }
            if (tests != null) {
                for (String test : tests) {
                    boolean accepted = session.simulate(test);
                    console.println("String '" + test + "' is " + (accepted ? "accepted" : "rejected") + " by the NFA.");
                }
            }
            if (testFile != null) {
                runSuite(session);
            }
            if (save) {
                session.save(nfaFile);
                console.println("NFA saved to " + nfaFile);
            }
            return 0;
        } catch (InvalidRegexException e) {
            LOG.error("Invalid regex ({}): {}", e.getErrorType(), e.getMessage());
        } catch (NFAConstructionException e) {
            LOG.error("Invalid regex ({}): {}", e.getErrorType(), e.getMessage());
        } catch (IOException e) {
            LOG.error("I/O failure: ", e);
        }
        return 1;
    }

    private void runSuite(RegexSession session) throws IOException {
        List<String> lines = Files.readAllLines(Paths.get(testFile), StandardCharsets.UTF_8);
        TestSuiteResult suite = session.runTestSuite(lines);
        if (suite.size() == 0) {
            LOG.warn("No test strings found in {}", testFile);
            return;
        }
        for (TestCaseResult result : suite.getResults()) {
            console.println(result.getInput() + "\t" + result.getVerdict());
        }
        console.println(suite.getAcceptedCount() + " accepted, " + suite.getRejectedCount() + " rejected");
        if (out != null) {
            TestSuiteCsvWriter.write(suite, Paths.get(out));
        }
    }

    public static Properties readProperties() {
        Properties properties = new Properties();
        // "/application.properties" is at src/main/resources/application.properties
        try (InputStream input = RegexNfaCli.class.getResourceAsStream("/application.properties")) {
            if (input == null) {
                LOG.warn("Unable to find application.properties in resources, using defaults.");
                return properties;
            }
            properties.load(input);
        } catch (IOException ex) {
            LOG.error("Failed to read application.properties: ", ex);
        }
        return properties;
    }

    private static Properties readPropertiesFromFile(String path) {
        Properties properties = readProperties();
        File propertiesFile = new File(path);
        if (!propertiesFile.exists()) {
            LOG.warn("Properties file not found: {}", path);
            return properties;
        }
        try (InputStream input = new FileInputStream(propertiesFile)) {
            properties.load(input);
            LOG.info("Loaded configuration from: {}", path);
        } catch (IOException ex) {
            LOG.error("Failed to load configuration from: " + path, ex);
        }
        return properties;
    }
}
