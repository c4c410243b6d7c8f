package exm.tdl.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.tdl.backend.TDLFormatter;
import exm.tdl.common.Settings;
import exm.tdl.common.exceptions.TDLFatal;
import exm.tdl.common.exceptions.UserException;
import exm.tdl.common.lang.Environment;
import exm.tdl.common.lang.LetterSet;
import exm.tdl.common.lang.TypeDefinition;
import exm.tdl.common.lang.WildCard;
import exm.tdl.frontend.TDLParser;

/**
 * Reads TDL files and prints what was found in them: a summary line
 * per type, or the definitions written back out as TDL.
 */
public class TDLInspector {

  private final Logger logger;
  private final PrintStream out;
  private final TDLFormatter formatter = new TDLFormatter();

  private boolean format = false;
  private boolean recover = false;
  private boolean strictCoreferences = false;

  /** Syntax errors skipped in recovery mode, over all files */
  private int skipped = 0;

  public TDLInspector(Logger logger, PrintStream out) {
    this.logger = logger;
    this.out = out;
  }

  public void setFormat(boolean format) {
    this.format = format;
  }

  public void setRecover(boolean recover) {
    this.recover = recover;
  }

  public void setStrictCoreferences(boolean strict) {
    this.strictCoreferences = strict;
  }

  /**
   * Inspect each file in turn
   * @throws TDLFatal with the exit code if anything went wrong
   */
  public void inspect(List<File> files, Charset charset) {
    try {
      if (logger.isDebugEnabled()) {
        for (String key: Settings.getKeys()) {
          logger.debug("setting " + key + "=" + Settings.get(key));
        }
      }
      for (File file: files) {
        inspectFile(file, charset);
      }
      out.flush();
    } catch (UserException e) {
      out.flush();
      System.err.println("tdl error:");
      System.err.println(e.getMessage());
      logger.debug("parse failed", e);
      throw new TDLFatal(ExitCode.ERROR_USER.code());
    } catch (IOException e) {
      out.flush();
      System.err.println("I/O error while reading input");
      System.err.println(e.getMessage());
      throw new TDLFatal(ExitCode.ERROR_IO.code());
    } catch (TDLFatal e) {
      throw e;
    } catch (AssertionError e) {
      reportInternalError(e);
      throw new TDLFatal(ExitCode.ERROR_INTERNAL.code());
    } catch (RuntimeException e) {
      reportInternalError(e);
      throw new TDLFatal(ExitCode.ERROR_INTERNAL.code());
    }

    if (skipped > 0) {
      System.err.println("tdl: skipped " + skipped +
                         " definition(s) with errors");
      throw new TDLFatal(ExitCode.ERROR_USER.code());
    }
  }

  private void inspectFile(File file, Charset charset)
      throws UserException, IOException {
    logger.debug("reading " + file + " as " + charset);
    TDLParser parser = TDLParser.fromFile(file, charset)
                                .setRecover(recover)
                                .setStrictCoreferences(strictCoreferences);
    TypeDefinition def;
    int count = 0;
    Environment shown = null;
    while ((def = parser.next()) != null) {
      count++;
      if (format) {
        shown = switchEnvironment(shown, def.getEnvironment());
        out.println(formatter.format(def));
        out.println();
      } else {
        out.println(summary(def));
      }
    }
    if (format) {
      switchEnvironment(shown, null);
      for (LetterSet set: parser.getLetterSets().values()) {
        out.println(formatter.format(set));
      }
      for (WildCard set: parser.getWildCards().values()) {
        out.println(formatter.format(set));
      }
    }
    skipped += parser.getErrors().size();
    logger.debug(file + ": " + count + " definitions, " +
                 parser.getErrors().size() + " skipped");
  }

  /**
   * Print the :end and :begin markers that lead from one block to
   * another, either of which may be null for top level.
   * @return to
   */
  private Environment switchEnvironment(Environment from, Environment to) {
    List<Environment> target = new ArrayList<Environment>();
    for (Environment e = to; e != null; e = e.getParent()) {
      target.add(0, e);
    }
    Environment common = from;
    while (common != null && !target.contains(common)) {
      out.println(formatter.end(common));
      out.println();
      common = common.getParent();
    }
    for (Environment e: target.subList(target.indexOf(common) + 1,
                                       target.size())) {
      out.println(formatter.begin(e));
      out.println();
    }
    return to;
  }

  /**
   * @return e.g. "noun := basic-noun & agr  features=3 corefs=1"
   */
  public static String summary(TypeDefinition def) {
    String supertypes = StringUtils.join(def.getSupertypes(), " & ");
    return def.getIdentifier() + " " + def.getOperator().token() + " " +
           (supertypes.isEmpty() ? "-" : supertypes) +
           "  features=" + def.features().size() +
           " corefs=" + def.getCoreferences().size();
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("TDL INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
