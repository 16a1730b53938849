/* (C)2026 */
package com.ammann.clinicalkpi.enumeration;

public enum VentilationEventType {
    INTUBATION,
    EXTUBATION
}
