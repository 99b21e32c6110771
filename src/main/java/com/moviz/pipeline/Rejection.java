package com.moviz.pipeline;

/**
 * Diagnostic tag for a dropped record.
 *
 * @param dataset   source dataset
 * @param rowNumber source row number
 * @param title     original title, if known
 * @param reason    first violated rule
 * @param detail    human readable detail
 */
public record Rejection(Dataset dataset, int rowNumber, String title, RejectReason reason, String detail) {}
