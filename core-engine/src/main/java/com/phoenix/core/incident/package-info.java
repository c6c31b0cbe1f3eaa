/**
 * Incident escalation: confidence scoring, severity and global cooldown.
 *
 * @since 1.0.0
 */
package com.phoenix.core.incident;
