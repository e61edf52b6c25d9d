package com.malwa.record_store.schema;

import static com.malwa.record_store.schema.IndexDefinition.of;
import static com.malwa.record_store.schema.IndexDefinition.unique;

/**
 * The ERP's collection table.
 *
 * Version history:
 * <ul>
 *   <li>1-7: base collections for customers, jobs, accounts, inventory, settings</li>
 *   <li>8: owner and date indexes on vendor and labour ledger entries</li>
 *   <li>9: owner and date indexes on supplier ledger entries, item index on stock movements</li>
 *   <li>10: unique code index on customers</li>
 * </ul>
 */
public final class ErpSchema {

    public static final int VERSION = 10;

    public static final String CUSTOMERS = "customers";
    public static final String CUSTOMER_LEDGER_ENTRIES = "customer_ledger_entries";
    public static final String VENDORS = "vendors";
    public static final String VENDOR_LEDGER_ENTRIES = "vendor_ledger_entries";
    public static final String LABOUR = "labour";
    public static final String LABOUR_LEDGER_ENTRIES = "labour_ledger_entries";
    public static final String SUPPLIERS = "suppliers";
    public static final String SUPPLIER_LEDGER_ENTRIES = "supplier_ledger_entries";
    public static final String INVENTORY_ITEMS = "inventory_items";
    public static final String STOCK_MOVEMENTS = "stock_movements";
    public static final String SEQUENCES = "sequences";

    private ErpSchema() {
    }

    public static SchemaRegistry registry() {
        return SchemaRegistry.builder(VERSION)
            // Customers
            .collection(CUSTOMERS,
                of("phone"), of("email"), of("name"), of("type"), of("company"), unique("code").since(10))
            .collection(CUSTOMER_LEDGER_ENTRIES, of("customer_id"), of("entry_date"))
            .collection("customer_jobs", of("customer_id"), unique("job_no"), of("status"))
            .collection("invoices", of("customer_id"), unique("invoice_no"))
            .collection("receipts")
            .collection("documents",
                of("customerId"), of("entityType"), of("entityId"), of("uploadedAt"), of("fileType"))

            // Vendors, labour, suppliers
            .collection(VENDORS, unique("code"), of("name"), of("serviceType"))
            .collection(VENDOR_LEDGER_ENTRIES, of("vendor_id").since(8), of("entry_date").since(8))
            .collection("vendor_services")
            .collection("service_orders")
            .collection("vendor_orders", of("vendorId"), of("jobId"), of("date"), of("status"))
            .collection("vendor_invoices",
                of("vendorId"), of("jobId"), of("serviceOrderId"), of("date"), of("status"))
            .collection("vendor_invoice_items", of("vendorInvoiceId"))
            .collection(LABOUR, unique("code"), of("technicianId"), of("employeeId"), of("vendorId"))
            .collection(LABOUR_LEDGER_ENTRIES, of("labour_id").since(8), of("entry_date").since(8))
            .collection(SUPPLIERS, unique("code"), of("name"), of("gstin"))
            .collection(SUPPLIER_LEDGER_ENTRIES, of("supplier_id").since(9), of("entry_date").since(9))
            .collection("supplier_products")

            // Inventory
            .collection("inventory_categories")
            .collection(INVENTORY_ITEMS, unique("code"), of("category_id"))
            .collection(STOCK_MOVEMENTS, of("item_id").since(9))
            .collection("stock_transactions", of("productId"), of("referenceType"), of("referenceId"), of("createdAt"))
            .collection("products")

            // Jobs
            .collection("jobs", of("status"), of("customerId"), of("scheduledStart"), of("createdAt"))
            .collection("inspections", of("jobId"), of("createdAt"))
            .collection("estimates", of("customerId"), of("jobId"), of("date"))
            .collection("estimate_items", of("estimateId"), of("productId"))
            .collection("jobsheets", of("jobId"), of("technicianId"), of("date"))
            .collection("jobsheet_items", of("jobsheetId"), of("productId"), of("isIssued"))
            .collection("challans", of("jobId"), of("customerId"), of("date"))
            .collection("challan_items", of("challanId"), of("productId"))
            .collection("invoice_items", of("invoiceId"), of("productId"))

            // Accounts
            .collection("accounts", unique("code"), of("type"), of("parentId"))
            .collection("journal_entries", of("sourceType"), of("sourceId"), of("date"))
            .collection("journal_lines", of("journalEntryId"), of("accountId"))
            .collection("vouchers")
            .collection("gst_ledger")
            .collection("gst_accounts")
            .collection("ledger_views")
            .collection("purchases", of("supplierId"), of("vendorId"), of("date"), of("status"))
            .collection("purchase_items", of("purchaseId"), of("productId"))
            .collection("purchase_challans", of("purchaseId"), of("supplierId"), of("date"))
            .collection("sell_challans")
            .collection("payments",
                of("invoiceId"), of("payeeId"), of("payeeType"), of("vendorId"), of("customerId"), of("date"))

            // Organisation and settings
            .collection("branches")
            .collection("profiles")
            .collection("users", unique("email"))
            .collection("templates", of("name"), of("type"), of("createdAt"))
            .collection("roles", unique("name"), of("createdAt"))
            .collection("permissions", of("roleId"), of("resource"))
            .collection("taxes", unique("code"), of("type"), of("rate"))
            .collection("hsn_codes", unique("hsn"), of("description"))
            .collection("audit_logs", of("userId"), of("actionType"), of("createdAt"), of("entityType"), of("entityId"))

            // Bookkeeping
            .collection("offline_operations", of("status"), of("createdAt"), of("priority"))
            .collection("meta")
            .collection("conflicts")
            .keyValueCollection(SEQUENCES)
            .build();
    }
}
