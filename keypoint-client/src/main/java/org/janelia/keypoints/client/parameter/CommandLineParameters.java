package org.janelia.keypoints.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.keypoints.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for the keypoint command line tools.
 *
 * <p>
 * Parsing does not exit the JVM. A help request prints usage and is reported through the
 * return value of {@link #parse}. Arguments that cannot be parsed or that fail {@link #validate}
 * raise an {@link IllegalArgumentException} whose message ends with the usage text,
 * so the client runner reports them like any other failure.
 * </p>
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public CommandLineParameters() {
        this.help = false;
    }

    /**
     * Parses arguments for the client class that encloses this parameters class.
     *
     * @return true if the client should run, false if only usage was requested.
     *
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed or are invalid.
     */
    public boolean parse(final String[] args)
            throws IllegalArgumentException {
        return parse(args, getProgramClass());
    }

    /**
     * @param  args          command line arguments.
     * @param  programClass  class with the main method (for usage output).
     *
     * @return true if the client should run, false if only usage was requested.
     *
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed or are invalid.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass)
            throws IllegalArgumentException {

        final JCommander jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp keypoint-client-standalone.jar " + programClass.getName());

        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            throw new IllegalArgumentException("failed to parse command line arguments: " + pe.getMessage() +
                                               "\n\n" + getUsage(jCommander), pe);
        }

        if (help) {
            jCommander.getConsole().println(getUsage(jCommander));
            return false;
        }

        try {
            validate();
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid command line arguments: " + e.getMessage() +
                                               "\n\n" + getUsage(jCommander), e);
        }

        LOG.debug("parse: parsed {} arguments for {}", args.length, programClass.getSimpleName());

        return true;
    }

    /**
     * Checks parsed values and derives defaults.
     * Called by {@link #parse} unless help was requested.
     *
     * @throws IllegalArgumentException
     *   if any value is invalid.
     */
    public void validate()
            throws IllegalArgumentException {
    }

    /**
     * @return JSON representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     *
     * @return result of parsing a help request (false unless parsing is broken).
     */
    public static boolean parseHelp(final CommandLineParameters parameters) {
        return parameters.parse(new String[] { "--help" }, parameters.getProgramClass());
    }

    private Class<?> getProgramClass() {
        final Class<?> enclosingClass = getClass().getEnclosingClass();
        return enclosingClass == null ? getClass() : enclosingClass;
    }

    private static String getUsage(final JCommander jCommander) {
        final StringBuilder usage = new StringBuilder();
        jCommander.getUsageFormatter().usage(usage);
        return usage.toString();
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
