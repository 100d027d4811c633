/**
 * Starts tools for a project.
 *
 * <h2>Launch pipeline</h2>
 *
 * <pre>
 * ToolLauncher         : orchestrates one launch, returns a LaunchResult
 * ExecutableResolver   : finds the binary inside a library entry
 * LaunchArguments      : closed per-tool argument table
 * OfflineOverride      : seam that prepares a tool for offline use
 * ProcessSpawner       : seam that actually starts the process
 * PathEnricher         : puts the tool's own directory first on PATH
 * </pre>
 *
 * <h2>Trust boundary</h2>
 * Project files are untrusted. An explicit executable path must stay inside
 * the project directory, and a declared SHA-256 must match the binary
 * exactly before anything is spawned.
 */
package de.bsommerfeld.toolvault.launcher;
