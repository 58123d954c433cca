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

package ellipticbn.utilities;

import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

import java.awt.GraphicsEnvironment;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.net.URL;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Collections.sort;
import static picocli.CommandLine.usage;

/**
 * Base ElliptiCBn Command class.
 *
 * @author Michael J. Schnieders
 */
public abstract class EllipticbnCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(EllipticbnCommand.class.getName());

  /**
   * Package searched for Commands given by their short name.
   */
  public static final String COMMAND_PACKAGE = "ellipticbn.macrocycle.commands";

  /**
   * Unix shells are able to evaluate PicoCLI ANSI color codes.
   *
   * <p>In a headless environment, color will be ON for command line help.
   */
  public final Ansi color;

  /**
   * The array of args passed into the Command.
   */
  public String[] args;

  /**
   * Parse Result.
   */
  public ParseResult parseResult = null;

  /**
   * -V or --version Prints the version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the ElliptiCBn version and exit.")
  public boolean version;

  /**
   * -h or --help Prints a help message.
   */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * The Binding that provides variables to this Command.
   */
  public EllipticbnBinding binding;

  /**
   * Default constructor for a Command.
   */
  public EllipticbnCommand() {
    this(new EllipticbnBinding());
  }

  /**
   * Create a Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public EllipticbnCommand(String[] args) {
    this(new EllipticbnBinding());
    binding.setVariable("args", Arrays.asList(args));
  }

  /**
   * Create a Command using the supplied Binding.
   *
   * @param binding the Binding that provides variables to this Command.
   */
  public EllipticbnCommand(EllipticbnBinding binding) {
    this.binding = binding;
    if (GraphicsEnvironment.isHeadless()) {
      color = Ansi.ON;
    } else {
      color = Ansi.OFF;
    }
  }

  /**
   * Set the Binding that provides variables to this Command.
   *
   * @param binding The Binding to use.
   */
  public void setBinding(EllipticbnBinding binding) {
    this.binding = binding;
  }

  /**
   * Use the ClassLoader to find the requested Command.
   *
   * @param name Name of the Command to load (e.g., Ellipticity).
   * @return The Command, if found, or null.
   */
  public static Class<? extends EllipticbnCommand> getCommand(String name) {
    ClassLoader loader = EllipticbnCommand.class.getClassLoader();
    Class<?> command;
    try {
      // First try to load the class directly.
      command = loader.loadClass(name);
    } catch (ClassNotFoundException e) {
      // Next, try to load a Command from the commands package.
      String pathName = COMMAND_PACKAGE + "." + name;
      try {
        command = loader.loadClass(pathName);
      } catch (ClassNotFoundException e2) {
        logger.warning(format(" %s was not found.", name));
        return null;
      }
    }
    if (!EllipticbnCommand.class.isAssignableFrom(command)) {
      logger.warning(format(" %s is not a command.", name));
      return null;
    }
    return command.asSubclass(EllipticbnCommand.class);
  }

  /**
   * List the embedded Commands.
   *
   * @return The short names of the available Commands, sorted alphabetically.
   */
  public static List<String> listCommands() {
    List<String> commands = new ArrayList<>();
    String location = COMMAND_PACKAGE.replace(".", "/");
    URL commandURL = EllipticbnCommand.class.getClassLoader().getResource(location);
    if (commandURL == null) {
      logger.info(format(" The %s resource could not be found by the classloader.", location));
      return commands;
    }

    String commandPath = URLDecoder.decode(commandURL.getPath(), StandardCharsets.UTF_8);
    if ("jar".equals(commandURL.getProtocol())) {
      String jarPath = commandPath.substring(5, commandPath.indexOf("!"));
      try (JarFile jar = new JarFile(jarPath)) {
        // Iterates over Jar entries.
        Enumeration<JarEntry> enumeration = jar.entries();
        while (enumeration.hasMoreElements()) {
          String className = enumeration.nextElement().getName();
          if (className.startsWith(location + "/")) {
            addCommand(className.substring(location.length() + 1), commands);
          }
        }
      } catch (Exception e) {
        logger.info(format(" The %s resource could not be decoded.", commandPath));
        return commands;
      }
    } else {
      String[] files = new File(commandPath).list();
      if (files != null) {
        for (String className : files) {
          addCommand(className, commands);
        }
      }
    }

    // Sort the commands alphabetically.
    sort(commands);
    return commands;
  }

  private static void addCommand(String className, List<String> commands) {
    if (className.endsWith(".class") && !className.contains("$") && !className.contains("/")) {
      commands.add(className.replace(".class", ""));
    }
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    StringOutputStream sos = new StringOutputStream(new ByteArrayOutputStream());
    usage(this, sos, color);
    return " " + sos;
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    // The args property could either be a list or an array of String arguments.
    Object arguments = binding.getVariable("args");

    if (arguments instanceof List<?> list) {
      int numArgs = list.size();
      args = new String[numArgs];
      for (int i = 0; i < numArgs; i++) {
        args[i] = (String) list.get(i);
      }
    } else if (arguments instanceof String[]) {
      args = (String[]) arguments;
    } else if (arguments instanceof String) {
      args = new String[]{(String) arguments};
    } else {
      args = new String[0];
    }

    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --minCC) are only preceded by one dash (such as -minCC, which is an error).");
      throw uae;
    }

    // Print help info exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    // Version info is handled by the Main class.
    return !version;
  }

  /**
   * Execute this Command.
   *
   * @return The current Command.
   */
  public EllipticbnCommand run() {
    logger.info(helpString());
    return this;
  }

  /**
   * The process exit status after {@link #run()}.
   *
   * @return zero unless the command failed.
   */
  public int getExitStatus() {
    return 0;
  }
}
