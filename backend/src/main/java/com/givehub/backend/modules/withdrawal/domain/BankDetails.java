package com.givehub.backend.modules.withdrawal.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class BankDetails {

    @Column(name = "bank_account_holder_name", length = 200)
    private String accountHolderName;

    @Column(name = "bank_name", length = 200)
    private String bankName;

    @Column(name = "bank_account_number", length = 64)
    private String accountNumber;

    @Column(name = "bank_branch_name", length = 200)
    private String branchName;

    @Column(name = "bank_swift_code", length = 16)
    private String swiftCode;

    protected BankDetails() {
    }

    public BankDetails(String accountHolderName, String bankName, String accountNumber, String branchName, String swiftCode) {
        this.accountHolderName = accountHolderName;
        this.bankName = bankName;
        this.accountNumber = accountNumber;
        this.branchName = branchName;
        this.swiftCode = swiftCode;
    }

    public String getAccountHolderName() {
        return accountHolderName;
    }

    public String getBankName() {
        return bankName;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public String getBranchName() {
        return branchName;
    }

    public String getSwiftCode() {
        return swiftCode;
    }
}
