/**
 * MeshPager source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.meshpager.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.meshpager.cli.MeshPagerCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.meshpager.runtime.Pipeline} runs receive, decrypt, decode, dedupe and forward.</li>
 *   <li>{@code io.meshpager.bus.BusConnection} owns the MQTT subscription and reconnects.</li>
 *   <li>{@code io.meshpager.storage.DedupeStore} is the authoritative record of processed packets.</li>
 * </ul>
 */
package io.meshpager;
