/**
 * Workflow definitions, the template renderer and the step-by-step execution engine.
 */
package io.syncbridge.workflow;
