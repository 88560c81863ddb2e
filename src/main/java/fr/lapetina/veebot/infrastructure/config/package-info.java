/**
 * Configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code http} - User agent and timeouts of the outbound HTTP client</li>
 *   <li>{@code youtube} - YouTube Data API base URL and key</li>
 * </ul>
 *
 * @see fr.lapetina.veebot.infrastructure.config.VeebotConfig
 * @see fr.lapetina.veebot.infrastructure.config.ConfigLoader
 */
package fr.lapetina.veebot.infrastructure.config;
