/* Repute © 2025 Repute Devs — MIT */
package dev.repute.commands;

/**
 * Who issued a command and where.
 *
 * @param guildId guild the command was issued in
 * @param channelId channel the command was issued in
 * @param callerId issuing participant
 * @param administrator whether the platform grants the caller administrator rights
 */
public record CommandContext(long guildId, long channelId, long callerId, boolean administrator) {}
