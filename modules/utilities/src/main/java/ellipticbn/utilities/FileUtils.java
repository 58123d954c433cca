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

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.logging.Logger;

import static java.lang.String.format;
import static org.apache.commons.io.FileUtils.forceDelete;
import static org.apache.commons.io.FileUtils.forceMkdir;

/**
 * FileUtils class.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class FileUtils {

  private static final Logger logger = Logger.getLogger(FileUtils.class.getName());

  /**
   * Private constructor to prevent instantiation.
   */
  private FileUtils() {
    // Empty constructor.
  }

  /**
   * Make sure the output directory exists.
   * <p>
   * A missing directory is created. If the path exists but is not a directory, it is replaced by a
   * directory only when overwrite is true.
   *
   * @param outputDir The output directory.
   * @param overwrite If true, a file in the way of the directory is removed.
   * @throws FileAlreadyExistsException If a file is in the way and overwrite is false.
   * @throws IOException If the directory could not be created.
   */
  public static void prepareOutputDirectory(File outputDir, boolean overwrite) throws IOException {
    if (outputDir.exists()) {
      if (outputDir.isDirectory()) {
        return;
      }
      if (!overwrite) {
        throw new FileAlreadyExistsException(outputDir.getPath(), null,
            "output directory already exists but is not a directory");
      }
      logger.info(format(" Replacing file %s with a directory.", outputDir));
      forceDelete(outputDir);
    }
    forceMkdir(outputDir);
  }

  /**
   * Resolve an output file.
   * <p>
   * A bare file name (no parent path) is placed in the output directory; a name with a path is
   * used as given. If the file exists it is deleted when overwrite is true.
   *
   * @param filename The requested file name.
   * @param outputDir The output directory used for bare file names.
   * @param overwrite If true, an existing file is removed.
   * @return The resolved output file.
   * @throws FileAlreadyExistsException If the file exists and overwrite is false.
   * @throws IOException If an existing file could not be deleted.
   */
  public static File resolveOutputFile(String filename, File outputDir, boolean overwrite)
      throws IOException {
    File file = new File(filename);
    if (file.getParent() == null) {
      file = new File(outputDir, filename);
    }

    if (file.exists()) {
      if (!overwrite) {
        throw new FileAlreadyExistsException(file.getPath(), null, "output file already exists");
      }
      forceDelete(file);
    }
    return file;
  }
}
