/**
 * Agent-side access to deployment command payloads (command.json).
 *
 * <ul>
 *   <li>{@link com.clusterops.command.model} – the payload as an immutable JSON tree ({@link com.clusterops.command.model.CommandDocument})</li>
 *   <li>{@link com.clusterops.command.lookup} – slash-delimited path walking ({@link com.clusterops.command.lookup.PathLookup}),
 *       lookup results and typed coercion</li>
 *   <li>{@link com.clusterops.command.consumer} – read-only contract ({@link com.clusterops.command.consumer.CommandValues})
 *       and the field accessor ({@link com.clusterops.command.consumer.ExecutionCommand})</li>
 *   <li>{@link com.clusterops.command.moduleconfig} – configurations and configuration attributes
 *       ({@link com.clusterops.command.moduleconfig.ModuleConfigs})</li>
 *   <li>{@link com.clusterops.command.load} – reading command files from the agent data directory</li>
 * </ul>
 */
package com.clusterops.command;
