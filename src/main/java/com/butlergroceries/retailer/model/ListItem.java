package com.butlergroceries.retailer.model;

/** Minimal entry pushed to the remote shopping list. */
public class ListItem {
    private String name;
    private int quantity;

    public ListItem() {
    }

    public ListItem(String name, int quantity) {
        this.name = name;
        this.quantity = quantity;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public int getQuantity() { return quantity; }
    public void setQuantity(int quantity) { this.quantity = quantity; }
}
