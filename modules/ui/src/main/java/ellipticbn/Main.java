// ******************************************************************************
//
// Title:       ElliptiCBn.
// Description: ElliptiCBn - Ellipticity of Cucurbituril Macrocycles.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2026.
//
// This file is part of ElliptiCBn.
//
// ElliptiCBn is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// ElliptiCBn is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// ElliptiCBn; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************

package ellipticbn;

import static java.lang.String.format;

import ellipticbn.ui.LogHandler;
import ellipticbn.utilities.EllipticbnBinding;
import ellipticbn.utilities.EllipticbnCommand;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.time.StopWatch;

/**
 * The Main class is the entry point to the ElliptiCBn command line interface.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  /** Constant border. */
  public static final String border =
      " ______________________________________________________________________________\n";
  /** Constant title. */
  public static final String title =
      "        ElliptiCBn - Ellipticity of Cucurbituril Macrocycles\n";
  /** Constant aboutString. */
  public static final String aboutString =
      "        Version " + version() + "\n"
          + "\n        Macrocycle detection and principal axis shape analysis"
          + "\n        of molecular geometries.\n";

  /** Handle ElliptiCBn logging. */
  private static LogHandler logHandler;
  /** Print version and exit. */
  private static boolean printVersionAndExit = false;

  private final StopWatch stopWatch = new StopWatch();

  private Main() {
  }

  /**
   * Run an ElliptiCBn command and exit with its status.
   *
   * @param args The command followed by its arguments.
   */
  public static void main(String[] args) {
    int status;
    try {
      status = run(args);
    } catch (Throwable t) {
      status = 1;
      logger.log(Level.SEVERE, " Uncaught exception: exiting with status code " + status, t);
    }
    System.exit(status);
  }

  /**
   * Process -D flags, start logging and run the requested command.
   *
   * @param args The command followed by its arguments.
   * @return the exit status.
   */
  public static int run(String[] args) {
    printVersionAndExit = false;

    // Process any "-D" command line flags.
    args = processProperties(args);

    // Configure our logging.
    startLogging();

    // Print the header.
    header(args);
    if (printVersionAndExit) {
      return 0;
    }

    // Print out help for the command line interface.
    if (args.length == 0) {
      commandLineInterfaceHelp();
      return 0;
    }

    Main main = new Main();
    return main.runCommand(args[0], Arrays.asList(args).subList(1, args.length));
  }

  /**
   * Find and run one command.
   *
   * @param name The command name.
   * @param argList The command arguments.
   * @return the exit status.
   */
  private int runCommand(String name, List<String> argList) {
    stopWatch.start();
    Class<? extends EllipticbnCommand> commandClass = EllipticbnCommand.getCommand(name);
    if (commandClass == null) {
      commandLineInterfaceHelp();
      return 1;
    }

    EllipticbnBinding binding = new EllipticbnBinding();
    binding.setVariable("args", new ArrayList<>(argList));
    EllipticbnCommand command;
    try {
      command = commandClass.getDeclaredConstructor(EllipticbnBinding.class).newInstance(binding);
    } catch (ReflectiveOperationException e) {
      logger.log(Level.WARNING, format(" %s could not be created.", name), e);
      return 1;
    }

    command.run();
    stopWatch.stop();

    int status = command.getExitStatus();
    if (logHandler != null && logHandler.isFatal()) {
      status = 1;
    }
    logger.info(format("\n %s finished in %s with status %d.", name, stopWatch, status));
    return status;
  }

  /** Print out help for the command line version of ElliptiCBn. */
  private static void commandLineInterfaceHelp() {
    logger.info(" usage: ellipticbn [-D<property=value>] <command> [-options] <XYZ>");
    logger.info("  where commands include:");
    for (String command : EllipticbnCommand.listCommands()) {
      logger.info("   " + command);
    }
    logger.info("\n For help on a specific command use:  ellipticbn <command> -h\n");
  }

  /** Print out a promo. */
  private static void header(String[] args) {
    StringBuilder sb = new StringBuilder();
    sb.append(border).append("\n");
    sb.append(title).append("\n");
    sb.append(aboutString);
    sb.append(border);

    // Print the version and exit.
    if (printVersionAndExit) {
      logger.info(sb.toString());
      return;
    }

    String hostName = null;
    try {
      hostName = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.fine(format(" The host name could not be determined: %s", e));
    }
    sb.append("\n ").append(new Date());
    sb.append(format("\n Process ID %d on %s.", ProcessHandle.current().pid(), hostName));

    // Print out command line arguments if the array is not null.
    if (args != null && args.length > 0) {
      sb.append("\n\n Command line arguments:\n ");
      sb.append(Arrays.toString(args));
      sb.append("\n");
    }

    logger.info(sb.toString());
  }

  /**
   * Process any "-D" command line flags.
   *
   * @param args The raw arguments.
   * @return the arguments that are not "-D" flags.
   */
  static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();

      if (arg.equals("-V") || arg.equals("--version")) {
        printVersionAndExit = true;
      }

      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        if (arg.contains("=")) {
          int equalsPosition = arg.indexOf("=");
          String key = arg.substring(0, equalsPosition);
          String value = arg.substring(equalsPosition + 1);
          // Set the system property.
          System.setProperty(key, value);
        } else {
          if (arg.length() > 0) {
            System.setProperty(arg, "");
          }
        }
      } else {
        // Collect non "-D" arguments.
        newArgs.add(arg);
      }
    }
    // Return the remaining arguments.
    return newArgs.toArray(new String[0]);
  }

  /** Replace the default console handler with our custom handler. */
  private static void startLogging() {
    // Remove all log handlers from the default logger.
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    Logger ellipticbnLogger = Logger.getLogger("ellipticbn");
    // Remove any existing handlers.
    for (Handler handler : ellipticbnLogger.getHandlers()) {
      ellipticbnLogger.removeHandler(handler);
    }

    // Retrieve the log level from the ellipticbn.log system property.
    String logLevel = System.getProperty("ellipticbn.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (IllegalArgumentException e) {
      level = Level.INFO;
    }

    logHandler = new LogHandler();
    logHandler.setLevel(level);
    ellipticbnLogger.addHandler(logHandler);
    ellipticbnLogger.setLevel(level);
  }

  private static String version() {
    String version = Main.class.getPackage().getImplementationVersion();
    return version == null ? "1.0.0-SNAPSHOT" : version;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Commons.Lang Style toString.
   */
  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("Up Time: " + stopWatch)
        .append("Logger: " + logger.getName())
        .toString();
  }
}
