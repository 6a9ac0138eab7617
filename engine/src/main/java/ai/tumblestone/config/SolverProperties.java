package ai.tumblestone.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the solver's console front end.
 *
 * <ul>
 *   <li>{@code solver.interactive}: wait for Enter between hints (default true). Disable
 *       to print the whole walkthrough at once, e.g. when output is piped.</li>
 *   <li>{@code solver.ansi}: color the board with ANSI escapes (default true).</li>
 * </ul>
 *
 * Usage:
 * {@code java -jar engine.jar --solver.interactive=false boards/level.tsb}
 */
@Component
@ConfigurationProperties(prefix = "solver")
public class SolverProperties {
  private boolean interactive = true;
  private boolean ansi = true;

  /**
   * Returns whether the walkthrough pauses for Enter between hints.
   */
  public boolean isInteractive() {
    return interactive;
  }

  public void setInteractive(boolean interactive) {
    this.interactive = interactive;
  }

  /**
   * Returns whether boards are rendered with ANSI colors.
   */
  public boolean isAnsi() {
    return ansi;
  }

  public void setAnsi(boolean ansi) {
    this.ansi = ansi;
  }
}
