/**
 * CoordMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.coordmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.coordmesh.cli.CoordMeshCommand} maps commands and the HTTP surface onto tool calls.</li>
 *   <li>{@code io.coordmesh.tools.CoordTools} is the JSON tool facade agents call.</li>
 *   <li>{@code io.coordmesh.coord.Coordinator} owns one project's agents, leases, inboxes and event log.</li>
 *   <li>{@code io.coordmesh.storage.Store} is the persistence seam (files or SQLite).</li>
 * </ul>
 */
package io.coordmesh;
