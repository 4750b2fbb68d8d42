package io.dockside.deploy.model;

/**
 * Where and how the source of a built application is laid out.
 *
 * @param codePath         checked-out source directory; relative paths resolve against the
 *                         application's code directory
 * @param dockerfile       Dockerfile path relative to the source directory (dockerfile builds)
 * @param contextPath      build context relative to the source directory (dockerfile builds)
 * @param buildStage       optional multi-stage target (dockerfile builds)
 * @param publishDirectory directory holding the files to serve (static builds)
 * @param herokuVersion    heroku builder stack version (heroku builds)
 */
public record BuildSettings(String codePath,
                            String dockerfile,
                            String contextPath,
                            String buildStage,
                            String publishDirectory,
                            String herokuVersion) {

  private static final BuildSettings EMPTY = new BuildSettings(null, null, null, null, null, null);

  public static BuildSettings empty() {
    return EMPTY;
  }
}
